package got.mail.app.repository;

import got.mail.app.entity.TwoFactorChallenge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface TwoFactorChallengeRepository extends JpaRepository<TwoFactorChallenge, String> {
    Optional<TwoFactorChallenge> findFirstByUserIdAndConsumedAtIsNullOrderByCreatedAtDesc(String userId);

    @Modifying
    @Query("UPDATE TwoFactorChallenge c SET c.consumedAt = :now WHERE c.user.id = :userId AND c.consumedAt IS NULL")
    int consumeOpenChallenges(@Param("userId") String userId, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM TwoFactorChallenge c WHERE c.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}

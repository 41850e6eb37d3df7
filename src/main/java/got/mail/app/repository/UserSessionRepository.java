package got.mail.app.repository;

import got.mail.app.entity.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, String> {

    // Fetch the user eagerly, the session resolves the request principal
    @Query("SELECT s FROM UserSession s JOIN FETCH s.user " +
           "WHERE s.tokenHash = :tokenHash AND s.revokedAt IS NULL AND s.expiresAt > :now")
    Optional<UserSession> findLiveByTokenHash(@Param("tokenHash") String tokenHash, @Param("now") Instant now);

    // Single conditional update, so a concurrent logout can never be undone by a stale read
    @Modifying
    @Query("UPDATE UserSession s SET s.revokedAt = :now " +
           "WHERE s.tokenHash = :tokenHash AND s.revokedAt IS NULL AND s.expiresAt > :now")
    int revokeLiveByTokenHash(@Param("tokenHash") String tokenHash, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM UserSession s WHERE s.expiresAt < :cutoff OR s.revokedAt < :cutoff")
    int deleteEndedBefore(@Param("cutoff") Instant cutoff);

    long countByUserId(String userId);
}

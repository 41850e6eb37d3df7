package got.mail.app.repository;

import got.mail.app.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, String> {
    boolean existsByPhoneNumber(String phoneNumber);
    Optional<User> findByPhoneNumber(String phoneNumber);
    Optional<User> findFirstByEmailIgnoreCaseOrderByCreatedAtAsc(String email);
    long countByPhoneNumber(String phoneNumber);
}

package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A login session. Only the SHA-256 digest of the issued token is stored;
 * the raw token is handed to the client once at login.
 */
@Entity
@Table(name = "user_sessions", indexes = {
    @Index(name = "idx_user_sessions_user", columnList = "user_id"),
    @Index(name = "idx_user_sessions_expires_at", columnList = "expires_at")
})
@Getter
@Setter
@ToString(exclude = "user")
@EqualsAndHashCode(of = "id")
public class UserSession {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "token_hash", unique = true, nullable = false, length = 64)
    private String tokenHash;

    @Column(nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    private Instant revokedAt;
}

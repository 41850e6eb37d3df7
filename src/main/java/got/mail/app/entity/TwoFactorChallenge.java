package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A pending two-factor verification code. The code itself is kept only as a hash
 * and is usable once, until {@code expiresAt}.
 */
@Entity
@Table(name = "two_factor_challenges")
@Getter
@Setter
@ToString(exclude = {"user", "codeHash"})
@EqualsAndHashCode(of = "id")
public class TwoFactorChallenge {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false)
    private String codeHash;

    @Column(nullable = false)
    private Instant expiresAt;

    private Instant consumedAt;

    private int attemptCount;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}

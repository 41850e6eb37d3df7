package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(exclude = "password")
@EqualsAndHashCode(of = "id")
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "phone_number", unique = true, nullable = false, length = 15)
    private String phoneNumber;

    // BCrypt hash, never the raw password
    @Column(nullable = false)
    private String password;

    private String firstName;

    private String lastName;

    private String email;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}

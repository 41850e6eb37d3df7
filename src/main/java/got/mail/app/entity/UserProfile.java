package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@ToString(exclude = "user")
@EqualsAndHashCode(of = "id")
public class UserProfile {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", unique = true, nullable = false)
    private User user;

    @Column(length = 500)
    private String bio;

    private LocalDate birthdate;

    // Reference returned by ProfilePictureStorage
    private String profilePicture;

    private boolean twoFactorEnabled;

    public static UserProfile emptyFor(User user) {
        UserProfile profile = new UserProfile();
        profile.setUser(user);
        return profile;
    }
}

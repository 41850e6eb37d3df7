package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "user_settings")
@Getter
@Setter
@ToString(exclude = "user")
@EqualsAndHashCode(of = "id")
public class UserSettings {
    public static final int DEFAULT_FONT_SIZE = 14;
    public static final String DEFAULT_FONT_FAMILY = "Arial";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    // Unique so that concurrent get-or-create cannot produce two rows
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", unique = true, nullable = false)
    private User user;

    private boolean autoReplyEnabled;

    private Instant autoReplyStartDate;

    private Instant autoReplyEndDate;

    @Column(length = 2000)
    private String autoReplyMessage;

    private Integer fontSize = DEFAULT_FONT_SIZE;

    @Column(length = 100)
    private String fontFamily = DEFAULT_FONT_FAMILY;

    private boolean darkMode;

    public static UserSettings defaultsFor(User user) {
        UserSettings settings = new UserSettings();
        settings.setUser(user);
        return settings;
    }
}

package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "labels", uniqueConstraints = {
    @UniqueConstraint(name = "uk_labels_user_name", columnNames = {"user_id", "name"})
})
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "user")
@EqualsAndHashCode(of = "id")
public class Label {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false, length = 100)
    private String name;

    // Hex color, e.g. #FF0000
    @Column(length = 7)
    private String color;

    public Label(User user, String name, String color) {
        this.user = user;
        this.name = name;
        this.color = color;
    }
}

package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "attachments")
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "email")
@EqualsAndHashCode(of = "id")
public class Attachment {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "email_id", nullable = false)
    private Email email;

    private String fileName;

    @Column(nullable = false, length = 1000)
    private String fileReference;

    public Attachment(String fileName, String fileReference) {
        this.fileName = fileName;
        this.fileReference = fileReference;
    }
}

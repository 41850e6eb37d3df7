package got.mail.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "emails", indexes = {
    @Index(name = "idx_emails_sender", columnList = "sender_id"),
    @Index(name = "idx_emails_sent_at", columnList = "sent_at")
})
@Getter
@Setter
@ToString(exclude = {"sender", "recipients", "labels", "attachments"})
@EqualsAndHashCode(of = "id")
public class Email {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sender_id", nullable = false)
    private User sender;

    @ManyToMany
    @JoinTable(name = "email_recipients",
            joinColumns = @JoinColumn(name = "email_id"),
            inverseJoinColumns = @JoinColumn(name = "user_id"))
    private Set<User> recipients = new HashSet<>();

    @Column(length = 255)
    private String subject;

    @Column(length = 20000)
    private String body;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @Column(name = "is_read")
    private boolean read;

    @Column(name = "is_starred")
    private boolean starred;

    @Column(name = "is_trashed")
    private boolean trashed;

    @ManyToMany
    @JoinTable(name = "email_labels",
            joinColumns = @JoinColumn(name = "email_id"),
            inverseJoinColumns = @JoinColumn(name = "label_id"))
    private Set<Label> labels = new HashSet<>();

    @OneToMany(mappedBy = "email", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<Attachment> attachments = new ArrayList<>();

    public void addAttachment(Attachment attachment) {
        attachment.setEmail(this);
        attachments.add(attachment);
    }
}

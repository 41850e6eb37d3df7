package got.mail.app.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import got.mail.app.entity.Attachment;
import got.mail.app.entity.Email;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailResponse {
    private String id;
    private UserResponse sender;
    private List<UserResponse> recipients;
    private String subject;
    private String body;
    private Instant sentAt;
    @JsonProperty("is_read")
    private boolean read;
    @JsonProperty("is_starred")
    private boolean starred;
    @JsonProperty("is_trashed")
    private boolean trashed;
    private List<LabelResponse> labels;
    private List<AttachmentResponse> attachments;

    /**
     * Must be called while the email's associations can still be loaded.
     */
    public static EmailResponse from(Email email) {
        return EmailResponse.builder()
                .id(email.getId())
                .sender(UserResponse.from(email.getSender()))
                .recipients(email.getRecipients().stream()
                        .map(UserResponse::from)
                        .sorted(Comparator.comparing(UserResponse::getPhoneNumber))
                        .collect(Collectors.toList()))
                .subject(email.getSubject())
                .body(email.getBody())
                .sentAt(email.getSentAt())
                .read(email.isRead())
                .starred(email.isStarred())
                .trashed(email.isTrashed())
                .labels(email.getLabels().stream()
                        .map(LabelResponse::from)
                        .sorted(Comparator.comparing(LabelResponse::getName))
                        .collect(Collectors.toList()))
                .attachments(email.getAttachments().stream()
                        .map(AttachmentResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AttachmentResponse {
        private String id;
        private String fileName;
        private String fileReference;

        static AttachmentResponse from(Attachment attachment) {
            return new AttachmentResponse(attachment.getId(), attachment.getFileName(), attachment.getFileReference());
        }
    }
}

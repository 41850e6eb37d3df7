package got.mail.app.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SendEmailRequest {
    /** Phone numbers or email addresses of registered users. */
    @NotEmpty(message = "At least one recipient is required.")
    private List<@NotBlank String> recipients;

    @Size(max = 255)
    private String subject;

    @Size(max = 20000)
    private String body;

    /** Names of the sender's own labels. */
    @Builder.Default
    private List<@NotBlank String> labels = new ArrayList<>();

    @Builder.Default
    private List<@NotNull @Valid AttachmentRequest> attachments = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AttachmentRequest {
        @NotBlank
        private String fileName;

        @NotBlank
        @Size(max = 1000)
        private String fileReference;
    }
}

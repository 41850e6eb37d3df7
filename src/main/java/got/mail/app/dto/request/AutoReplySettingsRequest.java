package got.mail.app.dto.request;

import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AutoReplySettingsRequest {
    private Boolean autoReplyEnabled;
    private Instant autoReplyStartDate;
    private Instant autoReplyEndDate;

    @Size(max = 2000)
    private String autoReplyMessage;
}

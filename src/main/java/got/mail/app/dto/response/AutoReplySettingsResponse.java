package got.mail.app.dto.response;

import got.mail.app.entity.UserSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoReplySettingsResponse {
    private boolean autoReplyEnabled;
    private Instant autoReplyStartDate;
    private Instant autoReplyEndDate;
    private String autoReplyMessage;

    public static AutoReplySettingsResponse from(UserSettings settings) {
        return AutoReplySettingsResponse.builder()
                .autoReplyEnabled(settings.isAutoReplyEnabled())
                .autoReplyStartDate(settings.getAutoReplyStartDate())
                .autoReplyEndDate(settings.getAutoReplyEndDate())
                .autoReplyMessage(settings.getAutoReplyMessage())
                .build();
    }
}

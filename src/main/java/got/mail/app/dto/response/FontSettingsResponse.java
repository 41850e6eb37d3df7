package got.mail.app.dto.response;

import got.mail.app.entity.UserSettings;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FontSettingsResponse {
    private Integer fontSize;
    private String fontFamily;

    public static FontSettingsResponse from(UserSettings settings) {
        return new FontSettingsResponse(settings.getFontSize(), settings.getFontFamily());
    }
}

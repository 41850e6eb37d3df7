package got.mail.app.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FontSettingsRequest {
    @Min(8)
    @Max(72)
    private Integer fontSize;

    @Size(max = 100)
    @Pattern(regexp = ".*\\S.*", message = "This field may not be blank.")
    private String fontFamily;
}

package got.mail.app.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoginRequest {
    /** Phone number or email address. */
    private String identifier;

    /** Accepted as an alias of {@code identifier}. */
    private String phoneNumber;

    @NotBlank(message = "This field is required.")
    private String password;

    public String resolveIdentifier() {
        if (identifier != null && !identifier.isBlank()) {
            return identifier.trim();
        }
        if (phoneNumber != null && !phoneNumber.isBlank()) {
            return phoneNumber.trim();
        }
        return null;
    }
}

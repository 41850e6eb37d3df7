package got.mail.app.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TwoFactorSetupResponse {
    private String message;
    private Instant expiresAt;
    // Only set when gotmail.two-factor.echo-code is enabled
    private String verificationCode;
}

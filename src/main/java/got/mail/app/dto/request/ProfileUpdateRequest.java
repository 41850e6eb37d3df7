package got.mail.app.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Partial profile update. Null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProfileUpdateRequest {
    @Size(max = 150)
    private String firstName;

    @Size(max = 150)
    private String lastName;

    @Email(message = "Enter a valid email address.")
    private String email;

    @Size(max = 500)
    private String bio;

    // yyyy-MM-dd, parsed by ProfileService
    private String birthdate;
}

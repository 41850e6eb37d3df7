package got.mail.app.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegisterRequest {
    @NotBlank(message = "This field is required.")
    private String phoneNumber;

    @NotBlank(message = "This field is required.")
    @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
    private String password;

    // Optional confirmation, checked against password when present
    private String password2;

    @NotBlank(message = "This field is required.")
    @Size(max = 150)
    private String firstName;

    @NotBlank(message = "This field is required.")
    @Size(max = 150)
    private String lastName;

    @NotBlank(message = "This field is required.")
    @Email(message = "Enter a valid email address.")
    private String email;
}

package got.mail.app.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * The single error envelope: {@code {"error": "...", "details": {"field": "..."}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {
    private String error;
    private Map<String, String> details;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}

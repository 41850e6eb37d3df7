package got.mail.app.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ValidationException extends WebmailException {
    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public ValidationException(String message, Map<String, String> fieldErrors) {
        super(HttpStatus.BAD_REQUEST, message, fieldErrors);
    }
}

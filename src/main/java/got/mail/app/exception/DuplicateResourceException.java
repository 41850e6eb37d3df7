package got.mail.app.exception;

import org.springframework.http.HttpStatus;

public class DuplicateResourceException extends WebmailException {
    public DuplicateResourceException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}

package got.mail.app.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends WebmailException {
    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}

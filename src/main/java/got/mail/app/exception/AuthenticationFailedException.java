package got.mail.app.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationFailedException extends WebmailException {
    public AuthenticationFailedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}

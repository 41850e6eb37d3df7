package got.mail.app.exception;

import org.springframework.http.HttpStatus;

/**
 * Login rejected. The message is the same whether or not the identifier exists.
 */
public class InvalidCredentialsException extends WebmailException {
    public InvalidCredentialsException() {
        super(HttpStatus.BAD_REQUEST, "Invalid credentials");
    }
}

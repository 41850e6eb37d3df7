package got.mail.app.exception;

import org.springframework.http.HttpStatus;

public class StorageException extends WebmailException {
    public StorageException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
        initCause(cause);
    }
}

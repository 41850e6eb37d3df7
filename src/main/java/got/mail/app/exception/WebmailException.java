package got.mail.app.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.Map;

/**
 * Base type for errors that map to a specific HTTP status and a client-facing message.
 * Anything that is not a {@code WebmailException} is treated as a server fault.
 */
@Getter
public abstract class WebmailException extends RuntimeException {
    private final HttpStatus status;
    private final Map<String, String> details;

    protected WebmailException(HttpStatus status, String message) {
        this(status, message, Collections.emptyMap());
    }

    protected WebmailException(HttpStatus status, String message, Map<String, String> details) {
        super(message);
        this.status = status;
        this.details = details == null ? Collections.emptyMap() : Map.copyOf(details);
    }
}

package got.mail.app.service;

import got.mail.app.entity.User;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * A freshly opened session. {@code token} is the raw value and exists only in memory.
 */
@Getter
@AllArgsConstructor
public class IssuedSession {
    private final User user;
    private final String token;
    private final Instant expiresAt;
}

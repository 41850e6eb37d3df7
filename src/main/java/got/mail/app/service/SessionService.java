package got.mail.app.service;

import got.mail.app.entity.User;
import got.mail.app.entity.UserSession;
import got.mail.app.repository.UserSessionRepository;
import got.mail.app.security.SessionTokens;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues, resolves and revokes session tokens. Lookups always go to the database so
 * a revoked token stops working on the very next request.
 */
@Slf4j
@Service
public class SessionService {
    private final UserSessionRepository userSessionRepository;

    @Value("${gotmail.session.ttl:PT24H}")
    private Duration sessionTtl;

    public SessionService(UserSessionRepository userSessionRepository) {
        this.userSessionRepository = userSessionRepository;
    }

    @Transactional
    public IssuedSession openSession(User user) {
        String token = SessionTokens.newToken();
        Instant now = Instant.now();

        UserSession session = new UserSession();
        session.setUser(user);
        session.setTokenHash(SessionTokens.digest(token));
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(sessionTtl));
        userSessionRepository.save(session);

        log.debug("Opened session {} for user {}, expires at {}", session.getId(), user.getId(), session.getExpiresAt());
        return new IssuedSession(user, token, session.getExpiresAt());
    }

    /**
     * Returns the owner of the token if it belongs to a session that is neither revoked nor expired.
     */
    @Transactional(readOnly = true)
    public Optional<User> resolveUser(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Optional.empty();
        }
        return userSessionRepository.findLiveByTokenHash(SessionTokens.digest(rawToken), Instant.now())
                .map(UserSession::getUser);
    }

    /**
     * Revokes the session behind the token. Unknown, expired and already revoked tokens are
     * ignored, so calling this twice is harmless.
     *
     * @return true if a live session was revoked by this call
     */
    @Transactional
    public boolean revoke(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return false;
        }
        int revoked = userSessionRepository.revokeLiveByTokenHash(SessionTokens.digest(rawToken), Instant.now());
        if (revoked > 0) {
            log.info("Session revoked");
        } else {
            log.debug("Logout for a token with no live session");
        }
        return revoked > 0;
    }
}

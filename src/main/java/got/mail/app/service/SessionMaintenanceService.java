package got.mail.app.service;

import got.mail.app.repository.TwoFactorChallengeRepository;
import got.mail.app.repository.UserSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodically drops sessions and two-factor challenges that ended more than
 * {@code gotmail.session.retention} ago.
 */
@Slf4j
@Service
public class SessionMaintenanceService {
    private final UserSessionRepository userSessionRepository;
    private final TwoFactorChallengeRepository challengeRepository;

    @Value("${gotmail.session.retention:P7D}")
    private Duration retention;

    public SessionMaintenanceService(UserSessionRepository userSessionRepository,
                                     TwoFactorChallengeRepository challengeRepository) {
        this.userSessionRepository = userSessionRepository;
        this.challengeRepository = challengeRepository;
    }

    @Scheduled(fixedDelayString = "${gotmail.session.cleanup-interval-ms:3600000}",
               initialDelayString = "${gotmail.session.cleanup-interval-ms:3600000}")
    @Transactional
    public void purgeEndedSessions() {
        Instant cutoff = Instant.now().minus(retention);
        int sessions = userSessionRepository.deleteEndedBefore(cutoff);
        int challenges = challengeRepository.deleteExpiredBefore(cutoff);
        if (sessions > 0 || challenges > 0) {
            log.info("Purged {} ended session(s) and {} expired two-factor challenge(s)", sessions, challenges);
        }
    }
}

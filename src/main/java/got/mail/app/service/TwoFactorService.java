package got.mail.app.service;

import got.mail.app.entity.TwoFactorChallenge;
import got.mail.app.entity.User;
import got.mail.app.entity.UserProfile;
import got.mail.app.exception.NotFoundException;
import got.mail.app.exception.ValidationException;
import got.mail.app.repository.TwoFactorChallengeRepository;
import got.mail.app.repository.UserProfileRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Two-factor enrolment: a 6-digit code is issued, stored hashed with a short expiry,
 * delivered through {@link VerificationCodeSender} and accepted once.
 */
@Slf4j
@Service
public class TwoFactorService {
    static final String INVALID_CODE = "Invalid verification code";
    private static final Pattern SIX_DIGITS = Pattern.compile("\\d{6}");

    private final TwoFactorChallengeRepository challengeRepository;
    private final UserProfileRepository userProfileRepository;
    private final PasswordEncoder passwordEncoder;
    private final VerificationCodeSender codeSender;
    private final SecureRandom secureRandom = new SecureRandom();

    @Value("${gotmail.two-factor.code-ttl:PT10M}")
    private Duration codeTtl;

    @Value("${gotmail.two-factor.max-attempts:5}")
    private int maxAttempts;

    public TwoFactorService(TwoFactorChallengeRepository challengeRepository,
                            UserProfileRepository userProfileRepository,
                            PasswordEncoder passwordEncoder,
                            VerificationCodeSender codeSender) {
        this.challengeRepository = challengeRepository;
        this.userProfileRepository = userProfileRepository;
        this.passwordEncoder = passwordEncoder;
        this.codeSender = codeSender;
    }

    /**
     * Issues a new code, superseding any earlier one that is still open.
     */
    @Transactional
    public IssuedCode issueCode(User user) {
        Instant now = Instant.now();
        challengeRepository.consumeOpenChallenges(user.getId(), now);

        String code = String.format("%06d", secureRandom.nextInt(1_000_000));
        TwoFactorChallenge challenge = new TwoFactorChallenge();
        challenge.setUser(user);
        challenge.setCodeHash(passwordEncoder.encode(code));
        challenge.setExpiresAt(now.plus(codeTtl));
        challengeRepository.save(challenge);

        codeSender.send(user, code);
        log.info("Issued two-factor challenge for user {}", user.getId());
        return new IssuedCode(code, challenge.getExpiresAt());
    }

    /**
     * Checks the code against the user's open challenge and, on a match, enables two-factor.
     * Failed attempts are counted and committed even though the call fails.
     */
    @Transactional(noRollbackFor = ValidationException.class)
    public void verify(User user, String code) {
        if (code == null || !SIX_DIGITS.matcher(code.trim()).matches()) {
            throw new ValidationException(INVALID_CODE);
        }

        Instant now = Instant.now();
        TwoFactorChallenge challenge = challengeRepository
                .findFirstByUserIdAndConsumedAtIsNullOrderByCreatedAtDesc(user.getId())
                .filter(c -> c.getExpiresAt().isAfter(now))
                .orElseThrow(() -> new ValidationException(INVALID_CODE));

        if (challenge.getAttemptCount() >= maxAttempts) {
            challenge.setConsumedAt(now);
            challengeRepository.save(challenge);
            log.warn("Two-factor challenge for user {} exhausted its attempts", user.getId());
            throw new ValidationException(INVALID_CODE);
        }

        challenge.setAttemptCount(challenge.getAttemptCount() + 1);
        if (!passwordEncoder.matches(code.trim(), challenge.getCodeHash())) {
            challengeRepository.save(challenge);
            log.info("Wrong two-factor code for user {} (attempt {})", user.getId(), challenge.getAttemptCount());
            throw new ValidationException(INVALID_CODE);
        }

        UserProfile profile = userProfileRepository.findByUserId(user.getId())
                .orElseThrow(() -> new NotFoundException("Profile not found"));
        challenge.setConsumedAt(now);
        challengeRepository.save(challenge);
        profile.setTwoFactorEnabled(true);
        userProfileRepository.save(profile);
        log.info("Two-factor authentication enabled for user {}", user.getId());
    }

    @Getter
    @AllArgsConstructor
    public static class IssuedCode {
        private final String code;
        private final Instant expiresAt;
    }
}

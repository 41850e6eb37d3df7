package got.mail.app.service;

import got.mail.app.dto.request.LoginRequest;
import got.mail.app.dto.request.RegisterRequest;
import got.mail.app.entity.Label;
import got.mail.app.entity.User;
import got.mail.app.entity.UserProfile;
import got.mail.app.entity.UserSettings;
import got.mail.app.exception.DuplicateResourceException;
import got.mail.app.exception.InvalidCredentialsException;
import got.mail.app.exception.ValidationException;
import got.mail.app.repository.LabelRepository;
import got.mail.app.repository.UserProfileRepository;
import got.mail.app.repository.UserRepository;
import got.mail.app.repository.UserSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
public class AccountService {
    static final String DUPLICATE_PHONE_MESSAGE = "Phone number already registered.";
    private static final Pattern PHONE_NUMBER = Pattern.compile("\\d{10,15}");

    private final UserRepository userRepository;
    private final UserProfileRepository userProfileRepository;
    private final UserSettingsRepository userSettingsRepository;
    private final LabelRepository labelRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionService sessionService;
    // Compared against when the identifier is unknown, so both failure paths hash once
    private final String unknownUserHash;

    public AccountService(UserRepository userRepository,
                          UserProfileRepository userProfileRepository,
                          UserSettingsRepository userSettingsRepository,
                          LabelRepository labelRepository,
                          PasswordEncoder passwordEncoder,
                          SessionService sessionService) {
        this.userRepository = userRepository;
        this.userProfileRepository = userProfileRepository;
        this.userSettingsRepository = userSettingsRepository;
        this.labelRepository = labelRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionService = sessionService;
        this.unknownUserHash = passwordEncoder.encode("unknown-user-placeholder");
    }

    /**
     * Creates the account together with its profile, settings and default labels.
     * All rows are written in one transaction; a failure leaves nothing behind.
     */
    @Transactional
    public User register(RegisterRequest request) {
        String phoneNumber = request.getPhoneNumber() == null ? null : request.getPhoneNumber().trim();
        validatePhoneNumber(phoneNumber);

        if (request.getPassword2() != null && !request.getPassword2().equals(request.getPassword())) {
            throw new ValidationException("Passwords do not match",
                    Map.of("password2", "Password fields didn't match."));
        }

        if (userRepository.existsByPhoneNumber(phoneNumber)) {
            throw new DuplicateResourceException(DUPLICATE_PHONE_MESSAGE);
        }

        User user = new User();
        user.setPhoneNumber(phoneNumber);
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setFirstName(request.getFirstName());
        user.setLastName(request.getLastName());
        user.setEmail(request.getEmail());
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with another registration of the same number
            log.warn("Concurrent registration detected for a phone number: {}", e.getMostSpecificCause().getMessage());
            throw new DuplicateResourceException(DUPLICATE_PHONE_MESSAGE);
        }

        userProfileRepository.save(UserProfile.emptyFor(user));
        userSettingsRepository.save(UserSettings.defaultsFor(user));
        labelRepository.saveAll(defaultLabels(user));

        log.info("Registered user {}", user.getId());
        return user;
    }

    @Transactional
    public IssuedSession login(LoginRequest request) {
        String identifier = request.resolveIdentifier();
        if (identifier == null) {
            throw new ValidationException("Invalid request", Map.of("identifier", "This field is required."));
        }

        Optional<User> candidate = findByIdentifier(identifier);
        if (candidate.isEmpty()) {
            passwordEncoder.matches(request.getPassword(), unknownUserHash);
            throw new InvalidCredentialsException();
        }

        User user = candidate.get();
        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.info("Failed login for user {}", user.getId());
            throw new InvalidCredentialsException();
        }

        IssuedSession session = sessionService.openSession(user);
        log.info("User {} logged in", user.getId());
        return session;
    }

    private Optional<User> findByIdentifier(String identifier) {
        Optional<User> byPhone = userRepository.findByPhoneNumber(identifier);
        if (byPhone.isPresent()) {
            return byPhone;
        }
        return userRepository.findFirstByEmailIgnoreCaseOrderByCreatedAtAsc(identifier);
    }

    static void validatePhoneNumber(String phoneNumber) {
        if (phoneNumber == null || !PHONE_NUMBER.matcher(phoneNumber).matches()) {
            throw new ValidationException("Invalid phone number",
                    Map.of("phone_number", "Phone number must be 10 to 15 digits."));
        }
    }

    static List<Label> defaultLabels(User user) {
        return List.of(
                new Label(user, "Important", "#FF0000"),
                new Label(user, "Personal", "#00FF00"),
                new Label(user, "Work", "#0000FF"));
    }
}

package got.mail.app.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import got.mail.app.dto.request.ProfileUpdateRequest;
import got.mail.app.dto.response.ProfileResponse;
import got.mail.app.entity.User;
import got.mail.app.entity.UserProfile;
import got.mail.app.exception.NotFoundException;
import got.mail.app.exception.ValidationException;
import got.mail.app.repository.UserProfileRepository;
import got.mail.app.repository.UserRepository;
import got.mail.app.storage.ProfilePictureStorage;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class ProfileService {
    private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE = new PropertyNamingStrategies.SnakeCaseStrategy();

    private final UserRepository userRepository;
    private final UserProfileRepository userProfileRepository;
    private final ProfilePictureStorage profilePictureStorage;
    private final Validator validator;

    public ProfileService(UserRepository userRepository,
                          UserProfileRepository userProfileRepository,
                          ProfilePictureStorage profilePictureStorage,
                          Validator validator) {
        this.userRepository = userRepository;
        this.userProfileRepository = userProfileRepository;
        this.profilePictureStorage = profilePictureStorage;
        this.validator = validator;
    }

    @Transactional(readOnly = true)
    public ProfileResponse getProfile(User user) {
        return ProfileResponse.of(user, loadProfile(user));
    }

    /**
     * Applies the non-null fields of the request to the account and its profile and,
     * when a picture is attached, replaces the stored picture.
     */
    @Transactional
    public ProfileResponse updateProfile(User principal, ProfileUpdateRequest request, MultipartFile picture) {
        validate(request);
        LocalDate birthdate = parseBirthdate(request.getBirthdate());

        User user = userRepository.findById(principal.getId())
                .orElseThrow(() -> new NotFoundException("User not found"));
        UserProfile profile = loadProfile(user);

        if (request.getFirstName() != null) {
            user.setFirstName(request.getFirstName());
        }
        if (request.getLastName() != null) {
            user.setLastName(request.getLastName());
        }
        if (request.getEmail() != null) {
            user.setEmail(request.getEmail());
        }
        if (request.getBio() != null) {
            profile.setBio(request.getBio());
        }
        if (birthdate != null) {
            profile.setBirthdate(birthdate);
        }
        if (picture != null && !picture.isEmpty()) {
            String previous = profile.getProfilePicture();
            profile.setProfilePicture(profilePictureStorage.store(user.getId(), picture));
            profilePictureStorage.delete(previous);
        }

        userRepository.save(user);
        userProfileRepository.save(profile);
        log.info("Updated profile for user {}", user.getId());
        return ProfileResponse.of(user, profile);
    }

    @Transactional
    public void deleteProfile(User user) {
        UserProfile profile = loadProfile(user);
        userProfileRepository.delete(profile);
        profilePictureStorage.delete(profile.getProfilePicture());
        log.info("Deleted profile for user {}", user.getId());
    }

    private UserProfile loadProfile(User user) {
        return userProfileRepository.findByUserId(user.getId())
                .orElseThrow(() -> new NotFoundException("Profile not found"));
    }

    private void validate(ProfileUpdateRequest request) {
        Set<ConstraintViolation<ProfileUpdateRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            Map<String, String> fieldErrors = new LinkedHashMap<>();
            for (ConstraintViolation<ProfileUpdateRequest> violation : violations) {
                fieldErrors.putIfAbsent(SNAKE_CASE.translate(violation.getPropertyPath().toString()),
                        violation.getMessage());
            }
            throw new ValidationException("Invalid request", fieldErrors);
        }
    }

    private static LocalDate parseBirthdate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid request",
                    Map.of("birthdate", "Date has wrong format. Use one of these formats instead: YYYY-MM-DD."));
        }
    }
}

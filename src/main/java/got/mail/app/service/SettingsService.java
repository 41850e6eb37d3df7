package got.mail.app.service;

import got.mail.app.dto.request.AutoReplySettingsRequest;
import got.mail.app.dto.request.DarkModeRequest;
import got.mail.app.dto.request.FontSettingsRequest;
import got.mail.app.dto.response.AutoReplySettingsResponse;
import got.mail.app.dto.response.DarkModeResponse;
import got.mail.app.dto.response.FontSettingsResponse;
import got.mail.app.entity.User;
import got.mail.app.entity.UserSettings;
import got.mail.app.exception.ValidationException;
import got.mail.app.repository.UserSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Auto-reply, font and dark mode preferences. Every operation works on the caller's
 * settings row, creating it with defaults on first access.
 */
@Slf4j
@Service
public class SettingsService {
    static final Duration DEFAULT_AUTO_REPLY_WINDOW = Duration.ofDays(30);

    private final UserSettingsProvisioner settingsProvisioner;
    private final UserSettingsRepository userSettingsRepository;

    public SettingsService(UserSettingsProvisioner settingsProvisioner,
                           UserSettingsRepository userSettingsRepository) {
        this.settingsProvisioner = settingsProvisioner;
        this.userSettingsRepository = userSettingsRepository;
    }

    public AutoReplySettingsResponse getAutoReply(User user) {
        return AutoReplySettingsResponse.from(settingsProvisioner.getOrCreate(user));
    }

    /**
     * Partial update. The window is checked against the values that would be stored,
     * so nothing is written when start would end up after end.
     */
    @Transactional
    public AutoReplySettingsResponse updateAutoReply(User user, AutoReplySettingsRequest request) {
        UserSettings settings = settingsProvisioner.getOrCreate(user);

        Instant start = request.getAutoReplyStartDate() != null
                ? request.getAutoReplyStartDate() : settings.getAutoReplyStartDate();
        Instant end = request.getAutoReplyEndDate() != null
                ? request.getAutoReplyEndDate() : settings.getAutoReplyEndDate();
        if (start != null && end != null && start.isAfter(end)) {
            throw new ValidationException("Start date must be before end date",
                    Map.of("auto_reply_end_date", "Must not be earlier than auto_reply_start_date."));
        }

        if (request.getAutoReplyEnabled() != null) {
            settings.setAutoReplyEnabled(request.getAutoReplyEnabled());
        }
        if (request.getAutoReplyMessage() != null) {
            settings.setAutoReplyMessage(request.getAutoReplyMessage());
        }
        settings.setAutoReplyStartDate(start);
        settings.setAutoReplyEndDate(end);

        UserSettings saved = userSettingsRepository.save(settings);
        log.info("Updated auto-reply settings for user {}", user.getId());
        return AutoReplySettingsResponse.from(saved);
    }

    /**
     * Flips auto-reply. Turning it on without a window opens one for the next 30 days.
     */
    @Transactional
    public AutoReplySettingsResponse toggleAutoReply(User user) {
        UserSettings settings = settingsProvisioner.getOrCreate(user);
        settings.setAutoReplyEnabled(!settings.isAutoReplyEnabled());

        if (settings.isAutoReplyEnabled()) {
            if (settings.getAutoReplyStartDate() == null) {
                settings.setAutoReplyStartDate(Instant.now());
            }
            if (settings.getAutoReplyEndDate() == null) {
                settings.setAutoReplyEndDate(settings.getAutoReplyStartDate().plus(DEFAULT_AUTO_REPLY_WINDOW));
            }
        }

        UserSettings saved = userSettingsRepository.save(settings);
        log.info("Auto-reply {} for user {}", saved.isAutoReplyEnabled() ? "enabled" : "disabled", user.getId());
        return AutoReplySettingsResponse.from(saved);
    }

    public FontSettingsResponse getFont(User user) {
        return FontSettingsResponse.from(settingsProvisioner.getOrCreate(user));
    }

    @Transactional
    public FontSettingsResponse updateFont(User user, FontSettingsRequest request) {
        UserSettings settings = settingsProvisioner.getOrCreate(user);
        if (request.getFontSize() != null) {
            settings.setFontSize(request.getFontSize());
        }
        if (request.getFontFamily() != null) {
            settings.setFontFamily(request.getFontFamily().trim());
        }
        return FontSettingsResponse.from(userSettingsRepository.save(settings));
    }

    public DarkModeResponse getDarkMode(User user) {
        return new DarkModeResponse(settingsProvisioner.getOrCreate(user).isDarkMode());
    }

    @Transactional
    public DarkModeResponse setDarkMode(User user, DarkModeRequest request) {
        if (request == null || request.getDarkMode() == null) {
            throw new ValidationException("dark_mode field is required");
        }
        UserSettings settings = settingsProvisioner.getOrCreate(user);
        settings.setDarkMode(request.getDarkMode());
        return new DarkModeResponse(userSettingsRepository.save(settings).isDarkMode());
    }
}

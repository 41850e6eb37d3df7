package got.mail.app.controller;

import got.mail.app.dto.request.AutoReplySettingsRequest;
import got.mail.app.dto.request.DarkModeRequest;
import got.mail.app.dto.request.FontSettingsRequest;
import got.mail.app.dto.response.AutoReplySettingsResponse;
import got.mail.app.dto.response.DarkModeResponse;
import got.mail.app.dto.response.FontSettingsResponse;
import got.mail.app.entity.User;
import got.mail.app.service.SettingsService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/settings")
public class SettingsController {
    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/auto-reply")
    public ResponseEntity<AutoReplySettingsResponse> getAutoReply(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(settingsService.getAutoReply(user));
    }

    @PutMapping("/auto-reply")
    public ResponseEntity<AutoReplySettingsResponse> updateAutoReply(@AuthenticationPrincipal User user,
                                                                     @Valid @RequestBody AutoReplySettingsRequest request) {
        return ResponseEntity.ok(settingsService.updateAutoReply(user, request));
    }

    // Toggle, no body
    @PatchMapping("/auto-reply")
    public ResponseEntity<AutoReplySettingsResponse> toggleAutoReply(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(settingsService.toggleAutoReply(user));
    }

    @GetMapping("/font")
    public ResponseEntity<FontSettingsResponse> getFont(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(settingsService.getFont(user));
    }

    @PutMapping("/font")
    public ResponseEntity<FontSettingsResponse> updateFont(@AuthenticationPrincipal User user,
                                                           @Valid @RequestBody FontSettingsRequest request) {
        return ResponseEntity.ok(settingsService.updateFont(user, request));
    }

    @GetMapping("/dark-mode")
    public ResponseEntity<DarkModeResponse> getDarkMode(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(settingsService.getDarkMode(user));
    }

    @PatchMapping("/dark-mode")
    public ResponseEntity<DarkModeResponse> setDarkMode(@AuthenticationPrincipal User user,
                                                        @RequestBody(required = false) DarkModeRequest request) {
        return ResponseEntity.ok(settingsService.setDarkMode(user, request));
    }
}

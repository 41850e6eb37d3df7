package got.mail.app.controller;

import got.mail.app.dto.request.ProfileUpdateRequest;
import got.mail.app.dto.response.ProfileResponse;
import got.mail.app.entity.User;
import got.mail.app.service.ProfileService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/profile")
public class ProfileController {
    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    public ResponseEntity<ProfileResponse> getProfile(@AuthenticationPrincipal User user) {
        return ResponseEntity.ok(profileService.getProfile(user));
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProfileResponse> updateProfile(@AuthenticationPrincipal User user,
                                                         @RequestBody ProfileUpdateRequest request) {
        return ResponseEntity.ok(profileService.updateProfile(user, request, null));
    }

    /**
     * Form variant, used when a new profile picture is uploaded.
     */
    @PutMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProfileResponse> updateProfileForm(
            @AuthenticationPrincipal User user,
            @RequestParam(name = "first_name", required = false) String firstName,
            @RequestParam(name = "last_name", required = false) String lastName,
            @RequestParam(name = "email", required = false) String email,
            @RequestParam(name = "bio", required = false) String bio,
            @RequestParam(name = "birthdate", required = false) String birthdate,
            @RequestPart(name = "profile_picture", required = false) MultipartFile profilePicture) {
        ProfileUpdateRequest request = ProfileUpdateRequest.builder()
                .firstName(firstName)
                .lastName(lastName)
                .email(email)
                .bio(bio)
                .birthdate(birthdate)
                .build();
        return ResponseEntity.ok(profileService.updateProfile(user, request, profilePicture));
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteProfile(@AuthenticationPrincipal User user) {
        profileService.deleteProfile(user);
        return ResponseEntity.noContent().build();
    }
}

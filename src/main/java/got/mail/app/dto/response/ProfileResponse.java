package got.mail.app.dto.response;

import got.mail.app.entity.User;
import got.mail.app.entity.UserProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {
    private UserResponse user;
    private Profile profile;

    public static ProfileResponse of(User user, UserProfile profile) {
        Profile body = Profile.builder()
                .bio(profile.getBio())
                .birthdate(profile.getBirthdate())
                .profilePicture(profile.getProfilePicture())
                .twoFactorEnabled(profile.isTwoFactorEnabled())
                .build();
        return new ProfileResponse(UserResponse.from(user), body);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Profile {
        private String bio;
        private LocalDate birthdate;
        private String profilePicture;
        private boolean twoFactorEnabled;
    }
}

package got.mail.app.controller;

import got.mail.app.dto.request.TwoFactorVerifyRequest;
import got.mail.app.dto.response.MessageResponse;
import got.mail.app.dto.response.TwoFactorSetupResponse;
import got.mail.app.entity.User;
import got.mail.app.service.TwoFactorService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/2fa/setup")
public class TwoFactorController {
    private final TwoFactorService twoFactorService;

    // Development only: puts the code in the response instead of relying on delivery
    @Value("${gotmail.two-factor.echo-code:false}")
    private boolean echoCode;

    public TwoFactorController(TwoFactorService twoFactorService) {
        this.twoFactorService = twoFactorService;
    }

    @PostMapping
    public ResponseEntity<TwoFactorSetupResponse> issueCode(@AuthenticationPrincipal User user) {
        TwoFactorService.IssuedCode issued = twoFactorService.issueCode(user);
        return ResponseEntity.ok(new TwoFactorSetupResponse(
                "Verification code generated",
                issued.getExpiresAt(),
                echoCode ? issued.getCode() : null));
    }

    @PutMapping
    public ResponseEntity<MessageResponse> verifyCode(@AuthenticationPrincipal User user,
                                                      @RequestBody(required = false) TwoFactorVerifyRequest request) {
        twoFactorService.verify(user, request == null ? null : request.getVerificationCode());
        return ResponseEntity.ok(new MessageResponse("Two-factor authentication enabled"));
    }
}

package got.mail.app.controller;

import got.mail.app.dto.request.LoginRequest;
import got.mail.app.dto.request.RegisterRequest;
import got.mail.app.dto.request.SessionTokenRequest;
import got.mail.app.dto.response.LoginResponse;
import got.mail.app.dto.response.MessageResponse;
import got.mail.app.dto.response.TokenValidationResponse;
import got.mail.app.dto.response.UserResponse;
import got.mail.app.entity.User;
import got.mail.app.exception.AuthenticationFailedException;
import got.mail.app.service.AccountService;
import got.mail.app.service.IssuedSession;
import got.mail.app.service.SessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

/**
 * Public account endpoints: registration, login, logout and token validation.
 */
@RestController
public class AuthController {
    private final AccountService accountService;
    private final SessionService sessionService;

    public AuthController(AccountService accountService, SessionService sessionService) {
        this.accountService = accountService;
        this.sessionService = sessionService;
    }

    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = accountService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        IssuedSession session = accountService.login(request);
        return ResponseEntity.ok(LoginResponse.builder()
                .user(UserResponse.from(session.getUser()))
                .sessionToken(session.getToken())
                .expiresAt(session.getExpiresAt())
                .build());
    }

    /**
     * Always succeeds: logging out with an unknown, expired or already revoked token is not an error.
     */
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(
            @RequestBody(required = false) SessionTokenRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        // An empty body token falls back to the header
        String token = request != null && StringUtils.hasText(request.getSessionToken())
                ? request.getSessionToken()
                : authorization;
        sessionService.revoke(token == null ? null : token.trim());
        return ResponseEntity.ok(new MessageResponse("Successfully logged out."));
    }

    @PostMapping("/validate-token")
    public ResponseEntity<TokenValidationResponse> validateToken(@RequestBody(required = false) SessionTokenRequest request) {
        String token = request == null ? null : request.getSessionToken();
        User user = sessionService.resolveUser(token)
                .orElseThrow(() -> new AuthenticationFailedException("Invalid or expired token"));
        return ResponseEntity.ok(new TokenValidationResponse(UserResponse.from(user), "Token is valid"));
    }
}

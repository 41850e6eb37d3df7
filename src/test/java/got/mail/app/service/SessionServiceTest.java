package got.mail.app.service;

import got.mail.app.entity.User;
import got.mail.app.entity.UserSession;
import got.mail.app.repository.UserSessionRepository;
import got.mail.app.security.SessionTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    @Mock
    private UserSessionRepository userSessionRepository;

    private SessionService sessionService;

    private User testUser;

    @BeforeEach
    void setUp() {
        sessionService = new SessionService(userSessionRepository);
        ReflectionTestUtils.setField(sessionService, "sessionTtl", Duration.ofHours(24));

        testUser = new User();
        testUser.setId("user123");
        testUser.setPhoneNumber("5551234567");
    }

    @Test
    void openSession_ShouldStoreDigestAndReturnRawToken() {
        // When
        Instant before = Instant.now();
        IssuedSession issued = sessionService.openSession(testUser);

        // Then
        ArgumentCaptor<UserSession> captor = ArgumentCaptor.forClass(UserSession.class);
        verify(userSessionRepository).save(captor.capture());
        UserSession stored = captor.getValue();

        assertNotNull(issued.getToken());
        assertNotEquals(issued.getToken(), stored.getTokenHash());
        assertEquals(SessionTokens.digest(issued.getToken()), stored.getTokenHash());
        assertSame(testUser, stored.getUser());
        assertNull(stored.getRevokedAt());
        assertFalse(stored.getExpiresAt().isBefore(before.plus(Duration.ofHours(24))));
        assertEquals(stored.getExpiresAt(), issued.getExpiresAt());
    }

    @Test
    void openSession_CalledTwice_ShouldIssueDistinctTokens() {
        // When
        IssuedSession first = sessionService.openSession(testUser);
        IssuedSession second = sessionService.openSession(testUser);

        // Then
        assertNotEquals(first.getToken(), second.getToken());
        verify(userSessionRepository, times(2)).save(any(UserSession.class));
    }

    @Test
    void resolveUser_WithLiveSession_ShouldReturnOwner() {
        // Given
        UserSession session = new UserSession();
        session.setUser(testUser);
        when(userSessionRepository.findLiveByTokenHash(eq(SessionTokens.digest("raw-token")), any(Instant.class)))
                .thenReturn(Optional.of(session));

        // When
        Optional<User> result = sessionService.resolveUser("raw-token");

        // Then
        assertTrue(result.isPresent());
        assertEquals("user123", result.get().getId());
    }

    @Test
    void resolveUser_WithUnknownToken_ShouldReturnEmpty() {
        // Given
        when(userSessionRepository.findLiveByTokenHash(anyString(), any(Instant.class))).thenReturn(Optional.empty());

        // When & Then
        assertTrue(sessionService.resolveUser("not-a-token").isEmpty());
    }

    @Test
    void resolveUser_WithBlankToken_ShouldNotQuery() {
        // When & Then
        assertTrue(sessionService.resolveUser("  ").isEmpty());
        assertTrue(sessionService.resolveUser(null).isEmpty());
        verifyNoInteractions(userSessionRepository);
    }

    @Test
    void revoke_WithLiveSession_ShouldReturnTrue() {
        // Given
        when(userSessionRepository.revokeLiveByTokenHash(eq(SessionTokens.digest("raw-token")), any(Instant.class)))
                .thenReturn(1);

        // When & Then
        assertTrue(sessionService.revoke("raw-token"));
    }

    @Test
    void revoke_WhenAlreadyRevoked_ShouldReturnFalseWithoutError() {
        // Given
        when(userSessionRepository.revokeLiveByTokenHash(anyString(), any(Instant.class))).thenReturn(0);

        // When & Then
        assertFalse(sessionService.revoke("raw-token"));
    }

    @Test
    void revoke_WithMissingToken_ShouldDoNothing() {
        // When & Then
        assertFalse(sessionService.revoke(null));
        verifyNoInteractions(userSessionRepository);
    }
}

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserProfileRepository userProfileRepository;

    @Mock
    private UserSettingsRepository userSettingsRepository;

    @Mock
    private LabelRepository labelRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private SessionService sessionService;

    @Captor
    private ArgumentCaptor<List<Label>> labelsCaptor;

    private AccountService accountService;

    private User existingUser;

    @BeforeEach
    void setUp() {
        accountService = new AccountService(userRepository, userProfileRepository, userSettingsRepository,
                labelRepository, passwordEncoder, sessionService);

        existingUser = new User();
        existingUser.setId("user123");
        existingUser.setPhoneNumber("5551234567");
        existingUser.setPassword("stored_hash");
        existingUser.setEmail("ada@example.com");
    }

    private RegisterRequest registration(String phoneNumber) {
        return RegisterRequest.builder()
                .phoneNumber(phoneNumber)
                .password("s3cretPass")
                .firstName("Ada")
                .lastName("Lovelace")
                .email("ada@example.com")
                .build();
    }

    @ParameterizedTest
    @ValueSource(strings = {"123456789", "1234567890123456", "", "55512345ab"})
    void register_WithInvalidPhoneNumber_ShouldFailWithoutCreatingUser(String phoneNumber) {
        // When & Then
        ValidationException exception = assertThrows(ValidationException.class,
                () -> accountService.register(registration(phoneNumber)));

        assertEquals("Invalid phone number", exception.getMessage());
        verify(userRepository, never()).saveAndFlush(any(User.class));
        verifyNoInteractions(userProfileRepository, userSettingsRepository, labelRepository);
    }

    @Test
    void register_WithAlreadyRegisteredPhone_ShouldFailWithDuplicateError() {
        // Given
        when(userRepository.existsByPhoneNumber("5551234567")).thenReturn(true);

        // When & Then
        DuplicateResourceException exception = assertThrows(DuplicateResourceException.class,
                () -> accountService.register(registration("5551234567")));

        assertEquals("Phone number already registered.", exception.getMessage());
        verify(userRepository, never()).saveAndFlush(any(User.class));
    }

    @Test
    void register_WhenInsertLosesRaceOnPhoneNumber_ShouldReportDuplicate() {
        // Given
        when(userRepository.existsByPhoneNumber("5551234567")).thenReturn(false);
        when(passwordEncoder.encode("s3cretPass")).thenReturn("hashed");
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key phone_number"));

        // When & Then
        assertThrows(DuplicateResourceException.class, () -> accountService.register(registration("5551234567")));
        verifyNoInteractions(userProfileRepository, userSettingsRepository, labelRepository);
    }

    @Test
    void register_WithMismatchedConfirmation_ShouldFail() {
        // Given
        RegisterRequest request = registration("5551234567");
        request.setPassword2("somethingElse");

        // When & Then
        ValidationException exception = assertThrows(ValidationException.class, () -> accountService.register(request));
        assertTrue(exception.getDetails().containsKey("password2"));
        verify(userRepository, never()).saveAndFlush(any(User.class));
    }

    @Test
    void register_WithValidInput_ShouldCreateUserProfileSettingsAndDefaultLabels() {
        // Given
        when(userRepository.existsByPhoneNumber("5551234567")).thenReturn(false);
        when(passwordEncoder.encode("s3cretPass")).thenReturn("hashed");
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            user.setId("user123");
            return user;
        });

        // When
        User created = accountService.register(registration(" 5551234567 "));

        // Then
        assertEquals("user123", created.getId());
        assertEquals("5551234567", created.getPhoneNumber());
        assertEquals("hashed", created.getPassword());

        verify(userProfileRepository).save(argThat((UserProfile profile) ->
                profile.getUser() == created && !profile.isTwoFactorEnabled()));
        verify(userSettingsRepository).save(argThat((UserSettings settings) ->
                settings.getUser() == created && !settings.isAutoReplyEnabled() && !settings.isDarkMode()));

        verify(labelRepository).saveAll(labelsCaptor.capture());
        List<Label> labels = labelsCaptor.getValue();
        assertEquals(List.of("Important", "Personal", "Work"),
                labels.stream().map(Label::getName).collect(Collectors.toList()));
        assertEquals(List.of("#FF0000", "#00FF00", "#0000FF"),
                labels.stream().map(Label::getColor).collect(Collectors.toList()));
        assertTrue(labels.stream().allMatch(label -> label.getUser() == created));
    }

    @Test
    void login_WithCorrectPassword_ShouldOpenSession() {
        // Given
        IssuedSession issued = new IssuedSession(existingUser, "raw-token", Instant.now().plusSeconds(3600));
        when(userRepository.findByPhoneNumber("5551234567")).thenReturn(Optional.of(existingUser));
        when(passwordEncoder.matches("s3cretPass", "stored_hash")).thenReturn(true);
        when(sessionService.openSession(existingUser)).thenReturn(issued);

        // When
        IssuedSession result = accountService.login(LoginRequest.builder()
                .identifier("5551234567")
                .password("s3cretPass")
                .build());

        // Then
        assertSame(issued, result);
    }

    @Test
    void login_WithEmailIdentifier_ShouldFallBackToEmailLookup() {
        // Given
        when(userRepository.findByPhoneNumber("ada@example.com")).thenReturn(Optional.empty());
        when(userRepository.findFirstByEmailIgnoreCaseOrderByCreatedAtAsc("ada@example.com"))
                .thenReturn(Optional.of(existingUser));
        when(passwordEncoder.matches("s3cretPass", "stored_hash")).thenReturn(true);
        when(sessionService.openSession(existingUser))
                .thenReturn(new IssuedSession(existingUser, "raw-token", Instant.now().plusSeconds(3600)));

        // When
        IssuedSession result = accountService.login(LoginRequest.builder()
                .identifier("ada@example.com")
                .password("s3cretPass")
                .build());

        // Then
        assertEquals("user123", result.getUser().getId());
    }

    @Test
    void login_WithPhoneNumberAlias_ShouldUseItAsIdentifier() {
        // Given
        when(userRepository.findByPhoneNumber("5551234567")).thenReturn(Optional.of(existingUser));
        when(passwordEncoder.matches("s3cretPass", "stored_hash")).thenReturn(true);
        when(sessionService.openSession(existingUser))
                .thenReturn(new IssuedSession(existingUser, "raw-token", Instant.now().plusSeconds(3600)));

        // When
        IssuedSession result = accountService.login(LoginRequest.builder()
                .phoneNumber("5551234567")
                .password("s3cretPass")
                .build());

        // Then
        assertEquals("raw-token", result.getToken());
    }

    @Test
    void login_WithWrongPassword_ShouldNotOpenSession() {
        // Given
        when(userRepository.findByPhoneNumber("5551234567")).thenReturn(Optional.of(existingUser));
        when(passwordEncoder.matches("wrong", "stored_hash")).thenReturn(false);

        // When & Then
        InvalidCredentialsException exception = assertThrows(InvalidCredentialsException.class,
                () -> accountService.login(LoginRequest.builder().identifier("5551234567").password("wrong").build()));

        assertEquals("Invalid credentials", exception.getMessage());
        verify(sessionService, never()).openSession(any());
    }

    @Test
    void login_WithUnknownIdentifier_ShouldFailWithSameMessageAsWrongPassword() {
        // Given
        when(userRepository.findByPhoneNumber("5550000000")).thenReturn(Optional.empty());
        when(userRepository.findFirstByEmailIgnoreCaseOrderByCreatedAtAsc("5550000000")).thenReturn(Optional.empty());

        // When & Then
        InvalidCredentialsException exception = assertThrows(InvalidCredentialsException.class,
                () -> accountService.login(LoginRequest.builder().identifier("5550000000").password("s3cretPass").build()));

        assertEquals("Invalid credentials", exception.getMessage());
        // A hash comparison still happens so the response time does not reveal the miss
        verify(passwordEncoder).matches(eq("s3cretPass"), any());
        verify(sessionService, never()).openSession(any());
    }

    @Test
    void login_WithoutIdentifier_ShouldFailValidation() {
        // When & Then
        ValidationException exception = assertThrows(ValidationException.class,
                () -> accountService.login(LoginRequest.builder().password("s3cretPass").build()));

        assertTrue(exception.getDetails().containsKey("identifier"));
        verifyNoInteractions(userRepository, sessionService);
    }
}

package got.mail.app.service;

import got.mail.app.entity.User;
import got.mail.app.entity.UserSettings;
import got.mail.app.repository.UserSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserSettingsProvisionerTest {

    @Mock
    private UserSettingsRepository userSettingsRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private UserSettingsProvisioner provisioner;

    private User testUser;

    @BeforeEach
    void setUp() {
        provisioner = new UserSettingsProvisioner(userSettingsRepository, transactionManager);

        testUser = new User();
        testUser.setId("user123");
    }

    @Test
    void getOrCreate_WhenRowExists_ShouldReturnItWithoutInserting() {
        // Given
        UserSettings existing = UserSettings.defaultsFor(testUser);
        existing.setDarkMode(true);
        when(userSettingsRepository.findByUserId("user123")).thenReturn(Optional.of(existing));

        // When
        UserSettings result = provisioner.getOrCreate(testUser);

        // Then
        assertSame(existing, result);
        verify(userSettingsRepository, never()).saveAndFlush(any());
        verifyNoInteractions(transactionManager);
    }

    @Test
    void getOrCreate_WhenRowMissing_ShouldInsertDefaultsInOwnTransaction() {
        // Given
        when(userSettingsRepository.findByUserId("user123")).thenReturn(Optional.empty());
        when(userSettingsRepository.saveAndFlush(any(UserSettings.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // When
        UserSettings result = provisioner.getOrCreate(testUser);

        // Then
        assertSame(testUser, result.getUser());
        assertEquals(14, result.getFontSize());
        assertEquals("Arial", result.getFontFamily());
        assertFalse(result.isAutoReplyEnabled());
        assertFalse(result.isDarkMode());
        verify(transactionManager).getTransaction(any());
        verify(transactionManager).commit(any());
    }

    @Test
    void getOrCreate_WhenConcurrentInsertWins_ShouldReturnCommittedRow() {
        // Given
        UserSettings winner = UserSettings.defaultsFor(testUser);
        winner.setId("settings1");
        when(userSettingsRepository.findByUserId("user123"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(userSettingsRepository.saveAndFlush(any(UserSettings.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key user_id"));

        // When
        UserSettings result = provisioner.getOrCreate(testUser);

        // Then
        assertSame(winner, result);
        verify(transactionManager).rollback(any());
    }

    @Test
    void getOrCreate_WhenInsertFailsAndNoRowExists_ShouldPropagate() {
        // Given
        when(userSettingsRepository.findByUserId("user123")).thenReturn(Optional.empty());
        when(userSettingsRepository.saveAndFlush(any(UserSettings.class)))
                .thenThrow(new DataIntegrityViolationException("not null violation"));

        // When & Then
        assertThrows(DataIntegrityViolationException.class, () -> provisioner.getOrCreate(testUser));
    }
}

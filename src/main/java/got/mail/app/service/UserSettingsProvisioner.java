package got.mail.app.service;

import got.mail.app.entity.User;
import got.mail.app.entity.UserSettings;
import got.mail.app.repository.UserSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Get-or-create for the per-user settings row.
 *
 * <p>The insert runs in its own transaction. When two first requests race, the unique
 * constraint on {@code user_id} rejects the second insert and that caller reads the
 * row the winner committed.
 */
@Slf4j
@Component
public class UserSettingsProvisioner {
    private final UserSettingsRepository userSettingsRepository;
    private final TransactionTemplate newTransaction;

    public UserSettingsProvisioner(UserSettingsRepository userSettingsRepository,
                                   PlatformTransactionManager transactionManager) {
        this.userSettingsRepository = userSettingsRepository;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public UserSettings getOrCreate(User user) {
        return userSettingsRepository.findByUserId(user.getId())
                .orElseGet(() -> insertDefaults(user));
    }

    private UserSettings insertDefaults(User user) {
        try {
            UserSettings created = newTransaction.execute(status ->
                    userSettingsRepository.saveAndFlush(UserSettings.defaultsFor(user)));
            log.debug("Created default settings for user {}", user.getId());
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("Settings for user {} were created concurrently, reading them back", user.getId());
            return userSettingsRepository.findByUserId(user.getId())
                    .orElseThrow(() -> e);
        }
    }
}

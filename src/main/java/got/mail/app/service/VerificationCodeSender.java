package got.mail.app.service;

import got.mail.app.entity.User;

/**
 * Out-of-band delivery of two-factor codes (SMS, email, ...).
 */
public interface VerificationCodeSender {
    void send(User user, String code);
}

package got.mail.app.service;

import got.mail.app.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sender used until a real SMS gateway is wired in. It records that a code was
 * issued but never writes the code itself to the log.
 */
@Slf4j
@Component
public class LoggingVerificationCodeSender implements VerificationCodeSender {

    @Override
    public void send(User user, String code) {
        log.info("Two-factor code issued for user {}; no delivery channel configured", user.getId());
    }
}

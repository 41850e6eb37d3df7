package got.mail.app.service;

import got.mail.app.dto.request.SendEmailRequest;
import got.mail.app.dto.response.EmailResponse;
import got.mail.app.entity.Attachment;
import got.mail.app.entity.Email;
import got.mail.app.entity.Label;
import got.mail.app.entity.User;
import got.mail.app.exception.ValidationException;
import got.mail.app.repository.EmailRepository;
import got.mail.app.repository.LabelRepository;
import got.mail.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class EmailService {
    private static final Sort MOST_RECENT_FIRST = Sort.by(Sort.Direction.DESC, "sentAt");

    private final EmailRepository emailRepository;
    private final UserRepository userRepository;
    private final LabelRepository labelRepository;

    public EmailService(EmailRepository emailRepository,
                        UserRepository userRepository,
                        LabelRepository labelRepository) {
        this.emailRepository = emailRepository;
        this.userRepository = userRepository;
        this.labelRepository = labelRepository;
    }

    /**
     * Stores a new email from {@code sender}. Every recipient must be a registered user and
     * every label one of the sender's own.
     */
    @Transactional
    public EmailResponse send(User sender, SendEmailRequest request) {
        Set<String> identifiers = request.getRecipients().stream()
                .map(String::trim)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Set<User> recipients = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String identifier : identifiers) {
            Optional<User> recipient = userRepository.findByPhoneNumber(identifier)
                    .or(() -> userRepository.findFirstByEmailIgnoreCaseOrderByCreatedAtAsc(identifier));
            if (recipient.isPresent()) {
                recipients.add(recipient.get());
            } else {
                unknown.add(identifier);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown recipients",
                    Map.of("recipients", "No account found for: " + String.join(", ", unknown)));
        }

        Set<Label> labels = resolveLabels(sender, request.getLabels());

        Email email = new Email();
        email.setSender(userRepository.getReferenceById(sender.getId()));
        email.setRecipients(recipients);
        email.setSubject(request.getSubject() == null ? "" : request.getSubject());
        email.setBody(request.getBody() == null ? "" : request.getBody());
        email.setSentAt(Instant.now());
        email.setLabels(labels);
        if (request.getAttachments() != null) {
            for (SendEmailRequest.AttachmentRequest attachment : request.getAttachments()) {
                email.addAttachment(new Attachment(attachment.getFileName(), attachment.getFileReference()));
            }
        }

        Email saved = emailRepository.save(email);
        log.info("User {} sent email {} to {} recipient(s)", sender.getId(), saved.getId(), recipients.size());
        return EmailResponse.from(saved);
    }

    /**
     * Mail the user sent or received, minus trash, narrowed by the criteria, most recent first.
     */
    @Transactional(readOnly = true)
    public List<EmailResponse> search(User user, EmailSearchCriteria criteria) {
        List<Email> emails = emailRepository.findAll(EmailSpecifications.matching(user.getId(), criteria), MOST_RECENT_FIRST);
        log.debug("Search for user {} matched {} email(s)", user.getId(), emails.size());
        return emails.stream()
                .map(EmailResponse::from)
                .collect(Collectors.toList());
    }

    private Set<Label> resolveLabels(User sender, List<String> names) {
        if (names == null || names.isEmpty()) {
            return new LinkedHashSet<>();
        }
        Set<String> wanted = names.stream().map(String::trim).collect(Collectors.toCollection(LinkedHashSet::new));
        List<Label> found = labelRepository.findByUserIdAndNameIn(sender.getId(), wanted);
        if (found.size() != wanted.size()) {
            Set<String> missing = new LinkedHashSet<>(wanted);
            found.forEach(label -> missing.remove(label.getName()));
            throw new ValidationException("Unknown labels",
                    Map.of("labels", "No such label: " + String.join(", ", missing)));
        }
        return new LinkedHashSet<>(found);
    }
}

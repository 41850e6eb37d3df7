package got.mail.app.service;

import got.mail.app.entity.Attachment;
import got.mail.app.entity.Email;
import got.mail.app.entity.Label;
import got.mail.app.entity.User;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.Locale;

/**
 * Predicates for mail search. {@link #matching(String, EmailSearchCriteria)} ANDs them in a
 * fixed order; every query is distinct because the recipient, label and attachment joins
 * would otherwise repeat rows.
 */
public final class EmailSpecifications {

    private EmailSpecifications() {
    }

    public static Specification<Email> matching(String userId, EmailSearchCriteria criteria) {
        Specification<Email> spec = Specification.where(visibleTo(userId)).and(notTrashed());
        if (criteria.hasTerms()) {
            for (String term : criteria.getTerms()) {
                spec = spec.and(containsText(term));
            }
        }
        if (criteria.hasDateRange()) {
            spec = spec.and(sentBetween(criteria.getSentFrom(), criteria.getSentTo()));
        }
        if (criteria.status().isPresent()) {
            spec = spec.and(criteria.status().get() == EmailSearchCriteria.StatusFilter.UNREAD ? unread() : starred());
        }
        if (criteria.label().isPresent()) {
            spec = spec.and(labelled(criteria.label().get()));
        }
        if (criteria.isWithAttachments()) {
            spec = spec.and(withAttachments());
        }
        return spec;
    }

    /** Caller sent it or is one of its recipients. */
    public static Specification<Email> visibleTo(String userId) {
        return (root, query, cb) -> {
            query.distinct(true);
            Join<Email, User> recipients = root.join("recipients", JoinType.LEFT);
            return cb.or(
                    cb.equal(root.get("sender").get("id"), userId),
                    cb.equal(recipients.get("id"), userId));
        };
    }

    public static Specification<Email> notTrashed() {
        return (root, query, cb) -> cb.isFalse(root.<Boolean>get("trashed"));
    }

    /** Case-insensitive substring match on subject, body or the sender's phone number. */
    public static Specification<Email> containsText(String text) {
        String pattern = "%" + escapeLike(text.toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.<String>get("subject")), pattern, '\\'),
                cb.like(cb.lower(root.<String>get("body")), pattern, '\\'),
                cb.like(root.get("sender").<String>get("phoneNumber"), pattern, '\\'));
    }

    public static Specification<Email> sentBetween(Instant from, Instant to) {
        return (root, query, cb) -> cb.between(root.<Instant>get("sentAt"), from, to);
    }

    public static Specification<Email> unread() {
        return (root, query, cb) -> cb.isFalse(root.<Boolean>get("read"));
    }

    public static Specification<Email> starred() {
        return (root, query, cb) -> cb.isTrue(root.<Boolean>get("starred"));
    }

    public static Specification<Email> labelled(String labelName) {
        return (root, query, cb) -> {
            query.distinct(true);
            Join<Email, Label> labels = root.join("labels", JoinType.INNER);
            return cb.equal(labels.get("name"), labelName);
        };
    }

    public static Specification<Email> withAttachments() {
        return (root, query, cb) -> {
            query.distinct(true);
            Join<Email, Attachment> attachments = root.join("attachments", JoinType.INNER);
            return cb.isNotNull(attachments.get("id"));
        };
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}

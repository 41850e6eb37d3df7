package got.mail.app.service;

import got.mail.app.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parsed mail search parameters. Raw query strings are validated here once; the
 * specification builder only ever sees typed values.
 */
@Getter
@Builder
public class EmailSearchCriteria {

    public enum StatusFilter {
        UNREAD, STARRED
    }

    private static final Pattern TERM_SEPARATORS = Pattern.compile("[\\s,]+");

    // Every term must appear in at least one searched field
    @Builder.Default
    private final List<String> terms = Collections.emptyList();
    private final Instant sentFrom;
    private final Instant sentTo;
    private final StatusFilter status;
    private final String label;
    private final boolean withAttachments;

    public boolean hasTerms() {
        return terms != null && !terms.isEmpty();
    }

    public Optional<StatusFilter> status() {
        return Optional.ofNullable(status);
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    /** Both bounds, or nothing: a lone bound does not restrict the search. */
    public boolean hasDateRange() {
        return sentFrom != null && sentTo != null;
    }

    /**
     * @param startDate     ISO date ({@code 2024-01-31}, start of day UTC) or ISO instant
     * @param endDate       ISO date (end of day UTC) or ISO instant
     * @param q             search terms separated by whitespace or commas
     * @param status        exactly {@code unread} or {@code starred}; anything else is ignored
     * @param hasAttachments {@code true}/{@code false}/{@code 1}/{@code 0}
     */
    public static EmailSearchCriteria fromQuery(String q, String startDate, String endDate,
                                                String status, String label, String hasAttachments) {
        Instant from = parseBound("start_date", startDate, false);
        Instant to = parseBound("end_date", endDate, true);
        if (from == null || to == null) {
            from = null;
            to = null;
        }
        return EmailSearchCriteria.builder()
                .terms(splitTerms(q))
                .sentFrom(from)
                .sentTo(to)
                .status(parseStatus(status))
                .label(blankToNull(label))
                .withAttachments(parseFlag("has_attachments", hasAttachments))
                .build();
    }

    private static Instant parseBound(String field, String value, boolean endOfDay) {
        String trimmed = blankToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            if (trimmed.length() == 10) {
                LocalDate date = LocalDate.parse(trimmed);
                return endOfDay
                        ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1)
                        : date.atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid search parameters",
                    Map.of(field, "Use YYYY-MM-DD or an ISO-8601 timestamp."));
        }
    }

    static List<String> splitTerms(String q) {
        if (q == null || q.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(TERM_SEPARATORS.split(q.trim()))
                .filter(term -> !term.isEmpty())
                .collect(Collectors.toList());
    }

    private static StatusFilter parseStatus(String value) {
        if ("unread".equals(value)) {
            return StatusFilter.UNREAD;
        }
        if ("starred".equals(value)) {
            return StatusFilter.STARRED;
        }
        return null;
    }

    private static boolean parseFlag(String field, String value) {
        String trimmed = blankToNull(value);
        if (trimmed == null) {
            return false;
        }
        switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
                return true;
            case "false":
            case "0":
                return false;
            default:
                throw new ValidationException("Invalid search parameters", Map.of(field, "Must be true or false."));
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

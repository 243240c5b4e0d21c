package tech.noetzold.screening_api.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Date handling shared by the recency rules of the probes and the entity resolver.
 *
 * <p>A date is recent when it lies no more than {@value #RECENT_WINDOW_DAYS} days before the
 * evaluation date. The boundary is inclusive, and dates after the evaluation date count as recent.
 */
public final class RiskDates {

    public static final int RECENT_WINDOW_DAYS = 365;

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern("yyyy-MMM-dd").toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern("dd-MMM-yyyy").toFormatter(Locale.ENGLISH),
            DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ENGLISH)
    );

    private RiskDates() {
    }

    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> parsed = tryParse(() -> LocalDate.parse(value, format));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return tryParse(() -> OffsetDateTime.parse(value).toLocalDate())
                .or(() -> tryParse(() -> LocalDateTime.parse(value).toLocalDate()));
    }

    private static Optional<LocalDate> tryParse(Supplier<LocalDate> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isRecent(LocalDate date, LocalDate evaluationDate) {
        return !date.isBefore(evaluationDate.minusDays(RECENT_WINDOW_DAYS));
    }
}

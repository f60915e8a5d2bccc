package dev.letterfinder.search;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inclusive date window sent to archives that accept a date range.
 *
 * @param start first day of the window
 * @param end   last day of the window
 */
public record SearchWindow(LocalDate start, LocalDate end) {

    private static final Pattern PERIOD_PATTERN =
            Pattern.compile("^\\s*(\\d{4}-\\d{2})\\s+to\\s+(\\d{4}-\\d{2})\\s*$", Pattern.CASE_INSENSITIVE);

    public SearchWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Search window needs both a start and an end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Search window ends before it starts: " + start + " to " + end);
        }
    }

    /**
     * Parse a period of the form {@code "YYYY-MM to YYYY-MM"} into a window running from the first
     * day of the start month to the last day of the end month.
     *
     * @param period the period text
     * @return the window, or empty if the text is malformed or the months are out of order
     */
    public static Optional<SearchWindow> parsePeriod(String period) {
        if (period == null) {
            return Optional.empty();
        }
        Matcher matcher = PERIOD_PATTERN.matcher(period);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            YearMonth from = YearMonth.parse(matcher.group(1));
            YearMonth to = YearMonth.parse(matcher.group(2));
            if (to.isBefore(from)) {
                return Optional.empty();
            }
            return Optional.of(new SearchWindow(from.atDay(1), to.atEndOfMonth()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}

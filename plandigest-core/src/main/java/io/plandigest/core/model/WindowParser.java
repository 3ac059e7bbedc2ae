package io.plandigest.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class WindowParser {
    private static final Pattern AGO_PATTERN = Pattern.compile("^(\\d+)\\s*(m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days)\\s+ago$");
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final List<Function<String, Instant>> ABSOLUTE_FORMATS = List.of(
        Instant::parse,
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value, DATE_TIME_SPACE).toInstant(ZoneOffset.UTC),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    public Instant parse(String expression, Clock clock) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("time expression is required");
        }

        String trimmed = expression.trim();
        String normalized = trimmed.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Instant keyword = switch (normalized) {
            case "now" -> now;
            case "today" -> today.atStartOfDay(ZoneOffset.UTC).toInstant();
            case "yesterday" -> today.minusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            default -> null;
        };
        if (keyword != null) {
            return keyword;
        }

        Matcher ago = AGO_PATTERN.matcher(normalized);
        if (ago.matches()) {
            long value = Long.parseLong(ago.group(1));
            Duration amount = switch (ago.group(2)) {
                case "m", "min", "mins", "minute", "minutes" -> Duration.ofMinutes(value);
                case "h", "hr", "hrs", "hour", "hours" -> Duration.ofHours(value);
                case "d", "day", "days" -> Duration.ofDays(value);
                default -> throw new IllegalArgumentException("unsupported time unit: " + ago.group(2));
            };
            return now.minus(amount);
        }

        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> format : ABSOLUTE_FORMATS) {
            try {
                return format.apply(trimmed);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new IllegalArgumentException("unable to parse time expression: " + expression, lastFailure);
    }

    public AnalysisWindow resolve(String since, String until, Clock clock) {
        if (since == null || since.isBlank()) {
            if (until != null && !until.isBlank()) {
                throw new IllegalArgumentException("--until requires --since");
            }
            return AnalysisWindow.lastDay(clock);
        }
        Instant start = parse(since, clock);
        Instant end = until == null || until.isBlank() ? null : parse(until, clock);
        return AnalysisWindow.of(start, end, clock);
    }
}

package io.plandigest.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Half-open interval {@code [since, until)} that scopes one analysis.
 */
public record AnalysisWindow(Instant since, Instant until) {
    public AnalysisWindow {
        Objects.requireNonNull(since, "since must not be null");
        Objects.requireNonNull(until, "until must not be null");
        if (since.isAfter(until)) {
            throw new IllegalArgumentException("window start " + since + " is after window end " + until);
        }
    }

    public static AnalysisWindow of(Instant since, Instant until, Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return new AnalysisWindow(since, until == null ? clock.instant() : until);
    }

    public static AnalysisWindow today(Clock clock) {
        Instant now = clock.instant();
        return new AnalysisWindow(startOfDay(now), now);
    }

    public static AnalysisWindow yesterday(Clock clock) {
        Instant start = startOfDay(clock.instant()).minus(Duration.ofDays(1));
        return new AnalysisWindow(start, start.plus(Duration.ofDays(1)));
    }

    public static AnalysisWindow lastDay(Clock clock) {
        Instant now = clock.instant();
        return new AnalysisWindow(now.minus(Duration.ofDays(1)), now);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(since) && instant.isBefore(until);
    }

    public Duration length() {
        return Duration.between(since, until);
    }

    private static Instant startOfDay(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}

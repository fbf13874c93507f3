package io.clustersearch.time;

import io.clustersearch.exceptions.InvalidTimeExpressionException;
import io.clustersearch.models.TimeRange;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts earliest/latest expressions into a concrete {@link TimeRange}.
 *
 * Supported expressions:
 * <ul>
 *   <li>{@code now}</li>
 *   <li>{@code now} followed by offsets, e.g. {@code now-4h}, {@code now-1d+30m}; units s, m, h, d, w, mon (or M), y</li>
 *   <li>epoch seconds, e.g. {@code 1700000000} or {@code 1700000000.5}</li>
 *   <li>local date/time in the configured zone: {@code 2016-11-18}, {@code 2016-11-18T23},
 *       {@code 2016-11-18T23:45}, {@code 2016-11-18T23:45:00}</li>
 *   <li>ISO-8601 date/time with offset, e.g. {@code 2016-11-18T23:45:00Z}</li>
 * </ul>
 * All expressions of one {@link #resolve} call share a single evaluation instant.
 */
@Slf4j
public class TimeResolver {

    private static final String NOW = "now";
    private static final Pattern RELATIVE = Pattern.compile("^now((?:[+-]\\d+(?:mon|[smhdwyM]))+)$");
    private static final Pattern OFFSET = Pattern.compile("([+-])(\\d+)(mon|[smhdwyM])");
    private static final Pattern EPOCH = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern LOCAL_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}(T\\d{2}(:\\d{2}(:\\d{2})?)?)?$");

    private static final DateTimeFormatter LOCAL_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd['T'HH[:mm[:ss]]]")
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
            .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
            .toFormatter();

    private final Clock clock;
    private final ZoneId zone;

    public TimeResolver(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    /**
     * Resolve a pair of expressions. When both are absent the platform default range is returned
     * unchanged; when only one is absent the missing bound comes from the default range. The default
     * range may be null when both expressions are given.
     *
     * @throws InvalidTimeExpressionException if an expression matches no supported grammar
     * @throws io.clustersearch.exceptions.InvalidTimeRangeException if earliest resolves after latest
     */
    public TimeRange resolve(String earliestExpr, String latestExpr, TimeRange platformDefaultRange) {
        boolean hasEarliest = !isAbsent(earliestExpr);
        boolean hasLatest = !isAbsent(latestExpr);
        if (!hasEarliest || !hasLatest) {
            Objects.requireNonNull(platformDefaultRange, "platformDefaultRange");
        }

        if (!hasEarliest && !hasLatest) {
            log.debug("No earliest/latest given, using platform default range {}", platformDefaultRange);
            return platformDefaultRange;
        }

        Instant now = clock.instant();
        Instant start = hasEarliest ? parse(earliestExpr, now) : platformDefaultRange.getStart();
        Instant end = hasLatest ? parse(latestExpr, now) : platformDefaultRange.getEnd();

        TimeRange range = TimeRange.of(start, end);
        log.debug("Resolved earliest='{}' latest='{}' to {}", earliestExpr, latestExpr, range);
        return range;
    }

    /**
     * Parse a single expression against the given evaluation instant.
     */
    public Instant parse(String expression, Instant now) {
        if (isAbsent(expression)) {
            throw new InvalidTimeExpressionException(String.valueOf(expression));
        }
        String trimmed = expression.trim();
        try {
            if (NOW.equals(trimmed)) {
                return now;
            }
            if (RELATIVE.matcher(trimmed).matches()) {
                return applyOffsets(trimmed.substring(NOW.length()), now);
            }
            if (EPOCH.matcher(trimmed).matches()) {
                return fromEpochSeconds(trimmed);
            }
            if (LOCAL_DATE_TIME.matcher(trimmed).matches()) {
                return LocalDateTime.parse(trimmed, LOCAL_FORMATTER).atZone(zone).toInstant();
            }
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            log.debug("Rejected time expression '{}': {}", trimmed, e.getMessage());
            throw new InvalidTimeExpressionException(trimmed);
        }
    }

    private Instant applyOffsets(String offsets, Instant now) {
        Matcher matcher = OFFSET.matcher(offsets);
        long totalSeconds = 0L;
        while (matcher.find()) {
            long amount = Long.parseLong(matcher.group(2));
            RelativeTimeUnit unit = RelativeTimeUnit.fromSuffix(matcher.group(3));
            long seconds = Math.multiplyExact(amount, unit.getSeconds());
            totalSeconds = "-".equals(matcher.group(1))
                    ? Math.subtractExact(totalSeconds, seconds)
                    : Math.addExact(totalSeconds, seconds);
        }
        return now.plusSeconds(totalSeconds);
    }

    private static Instant fromEpochSeconds(String value) {
        BigDecimal seconds = new BigDecimal(value);
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).movePointRight(9).longValue();
        return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    }

    private static boolean isAbsent(String expression) {
        return expression == null || expression.trim().isEmpty();
    }
}

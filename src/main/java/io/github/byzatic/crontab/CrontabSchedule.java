package io.github.byzatic.crontab;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.crontab.base_exceptions.CrontabParseException;
import io.github.byzatic.crontab.base_exceptions.UnsatisfiableScheduleException;
import io.github.byzatic.crontab.field.CrontabField;
import io.github.byzatic.crontab.field.CrontabFieldKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed crontab schedule.
 * <p>
 * Five fields ({@code min hour dom mon dow}) or, with {@link ParseOptions#isIncludingSeconds()},
 * six fields ({@code sec min hour dom mon dow}). In five-field mode the schedule fires at
 * second 0 only.
 *
 * <h3>Day matching</h3>
 * When both day-of-month and day-of-week are restricted a day qualifies if it matches
 * <em>either</em> of them. When one of them is {@code *} only the other one applies.
 *
 * <h3>Thread-safety</h3>
 * Instances are immutable and may be shared freely; every search works on its own cursor.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * CrontabSchedule schedule = CrontabSchedule.parse("30 12 * * Mon");
 * LocalDateTime next = schedule.nextOccurrence(LocalDateTime.of(2003, 1, 1, 0, 0)); // 2003-01-06T12:30
 * }</pre>
 */
@ThreadSafe
public final class CrontabSchedule {
    private final static Logger logger = LoggerFactory.getLogger(CrontabSchedule.class);

    /**
     * The Gregorian calendar repeats every 400 years, so a schedule without an
     * occurrence in that span never fires.
     */
    static final int MAX_SEARCH_YEARS = 400;

    private static final Splitter FIELD_SPLITTER =
            Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final boolean includingSeconds;
    private final CrontabField seconds;
    private final CrontabField minutes;
    private final CrontabField hours;
    private final CrontabField days;
    private final CrontabField months;
    private final CrontabField daysOfWeek;
    private final String expression;

    private CrontabSchedule(boolean includingSeconds, CrontabField seconds, CrontabField minutes,
                            CrontabField hours, CrontabField days, CrontabField months, CrontabField daysOfWeek) {
        this.includingSeconds = includingSeconds;
        this.seconds = seconds;
        this.minutes = minutes;
        this.hours = hours;
        this.days = days;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
        this.expression = render();
    }

    // ======== Parsing ========

    public static @NotNull CrontabSchedule parse(String expression) {
        return parse(expression, ParseOptions.DEFAULT);
    }

    /**
     * Parses a crontab expression.
     *
     * @throws NullPointerException  if {@code expression} or {@code options} is null
     * @throws CrontabParseException if the field count is wrong or any field is malformed
     */
    public static @NotNull CrontabSchedule parse(String expression, @NotNull ParseOptions options) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(options, "options");

        List<String> parts = FIELD_SPLITTER.splitToList(expression);
        int expected = options.isIncludingSeconds() ? 6 : 5;
        if (parts.size() != expected) {
            throw CrontabParseException.wrongFieldCount(expression, expected, parts.size());
        }

        int idx = 0;
        CrontabField seconds = options.isIncludingSeconds()
                ? CrontabField.parse(CrontabFieldKind.SECOND, parts.get(idx++))
                : CrontabField.of(CrontabFieldKind.SECOND, 0);
        CrontabField minutes = CrontabField.parse(CrontabFieldKind.MINUTE, parts.get(idx++));
        CrontabField hours = CrontabField.parse(CrontabFieldKind.HOUR, parts.get(idx++));
        CrontabField days = CrontabField.parse(CrontabFieldKind.DAY, parts.get(idx++));
        CrontabField months = CrontabField.parse(CrontabFieldKind.MONTH, parts.get(idx++));
        CrontabField daysOfWeek = CrontabField.parse(CrontabFieldKind.DAY_OF_WEEK, parts.get(idx));

        CrontabSchedule schedule = new CrontabSchedule(options.isIncludingSeconds(),
                seconds, minutes, hours, days, months, daysOfWeek);
        logger.debug("Parsed crontab '{}' as '{}'", expression, schedule);
        return schedule;
    }

    /**
     * Same as {@link #parse(String, ParseOptions)} but reports grammar errors as an empty result.
     */
    public static @NotNull Optional<CrontabSchedule> tryParse(String expression, @NotNull ParseOptions options) {
        Objects.requireNonNull(expression, "expression");
        try {
            return Optional.of(parse(expression, options));
        } catch (CrontabParseException e) {
            logger.trace("Rejected crontab '{}': {}", expression, e.getMessage());
            return Optional.empty();
        }
    }

    public static @NotNull Optional<CrontabSchedule> tryParse(String expression) {
        return tryParse(expression, ParseOptions.DEFAULT);
    }

    // ======== Occurrences ========

    /**
     * First fire time strictly after {@code after}.
     *
     * @throws UnsatisfiableScheduleException if the schedule can never fire
     */
    public @NotNull LocalDateTime nextOccurrence(@NotNull LocalDateTime after) {
        Objects.requireNonNull(after, "after");
        return search(after, null);
    }

    /**
     * First fire time strictly after {@code after}, or {@code until} itself if no fire time
     * lies before it. The bound is returned verbatim even if it does not match the schedule.
     * Never throws for unsatisfiable schedules: the search stops once it reaches {@code until}
     * or gives up, whichever comes first.
     */
    public @NotNull LocalDateTime nextOccurrence(@NotNull LocalDateTime after, @NotNull LocalDateTime until) {
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(until, "until");
        return search(after, until);
    }

    /**
     * All fire times in the open interval ({@code after}, {@code until}), ascending.
     */
    public @NotNull List<LocalDateTime> nextOccurrences(@NotNull LocalDateTime after, @NotNull LocalDateTime until) {
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(until, "until");
        ImmutableList.Builder<LocalDateTime> out = ImmutableList.builder();
        LocalDateTime occurrence = search(after, until);
        while (occurrence.isBefore(until)) {
            out.add(occurrence);
            occurrence = search(occurrence, until);
        }
        return out.build();
    }

    /**
     * Bridge for callers working with instants: the search runs on the calendar fields
     * of {@code after} in {@code zone}.
     *
     * @return the next fire instant, or empty if the schedule can never fire
     */
    public @NotNull Optional<Instant> nextOccurrence(@NotNull Instant after, @NotNull ZoneId zone) {
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(zone, "zone");
        LocalDateTime cursor = LocalDateTime.ofInstant(after, zone);
        try {
            while (true) {
                cursor = search(cursor, null);
                Instant candidate = cursor.atZone(zone).toInstant();
                // a repeated local hour can map back before 'after'
                if (candidate.isAfter(after)) {
                    return Optional.of(candidate);
                }
            }
        } catch (UnsatisfiableScheduleException e) {
            logger.debug("No occurrence of '{}' after {}", expression, after);
            return Optional.empty();
        }
    }

    /**
     * Carry search over (year, month, day, hour, minute, second). Each step looks up the
     * first member at or after the cursor's value; a miss carries into the next higher
     * unit and restarts with every lower unit at its minimum.
     */
    private LocalDateTime search(LocalDateTime after, @Nullable LocalDateTime until) {
        LocalDateTime cursor = includingSeconds
                ? after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1)
                : after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        int lastYear = cursor.getYear() + MAX_SEARCH_YEARS;

        while (true) {
            if (until != null && !cursor.isBefore(until)) {
                return until;
            }
            if (cursor.getYear() > lastYear) {
                if (until != null) {
                    // never fires, so nothing lies before the bound either
                    return until;
                }
                logger.warn("Giving up on crontab '{}': no occurrence within {} years after {}",
                        expression, MAX_SEARCH_YEARS, after);
                throw new UnsatisfiableScheduleException(expression, after, MAX_SEARCH_YEARS);
            }

            int month = months.next(cursor.getMonthValue());
            if (month < 0) {
                cursor = LocalDate.of(cursor.getYear() + 1, 1, 1).atStartOfDay();
                continue;
            }
            if (month != cursor.getMonthValue()) {
                cursor = LocalDate.of(cursor.getYear(), month, 1).atStartOfDay();
            }

            int day = nextDay(cursor.toLocalDate());
            if (day < 0) {
                cursor = cursor.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (day != cursor.getDayOfMonth()) {
                cursor = cursor.toLocalDate().withDayOfMonth(day).atStartOfDay();
            }

            int hour = hours.next(cursor.getHour());
            if (hour < 0) {
                cursor = cursor.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (hour != cursor.getHour()) {
                cursor = cursor.withHour(hour).truncatedTo(ChronoUnit.HOURS);
            }

            int minute = minutes.next(cursor.getMinute());
            if (minute < 0) {
                cursor = cursor.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (minute != cursor.getMinute()) {
                cursor = cursor.withMinute(minute).truncatedTo(ChronoUnit.MINUTES);
            }

            int second = seconds.next(cursor.getSecond());
            if (second < 0) {
                cursor = cursor.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
                continue;
            }
            cursor = cursor.withSecond(second);

            if (until != null && !cursor.isBefore(until)) {
                return until;
            }
            logger.trace("Next occurrence of '{}' after {} is {}", expression, after, cursor);
            return cursor;
        }
    }

    /**
     * @return the first qualifying day of {@code from}'s month at or after {@code from}, or {@code -1}
     */
    private int nextDay(LocalDate from) {
        int length = from.lengthOfMonth();
        LocalDate date = from;
        for (int day = from.getDayOfMonth(); day <= length; day++, date = date.plusDays(1)) {
            if (matchesDay(date)) {
                return day;
            }
        }
        return -1;
    }

    private boolean matchesDay(LocalDate date) {
        boolean anyDayOfMonth = days.isFull();
        boolean anyDayOfWeek = daysOfWeek.isFull();
        int dayOfWeek = date.getDayOfWeek().getValue() % 7;
        if (anyDayOfMonth && anyDayOfWeek) {
            return true;
        }
        if (anyDayOfMonth) {
            return daysOfWeek.contains(dayOfWeek);
        }
        if (anyDayOfWeek) {
            return days.contains(date.getDayOfMonth());
        }
        return days.contains(date.getDayOfMonth()) || daysOfWeek.contains(dayOfWeek);
    }

    // ======== Accessors ========

    public boolean isIncludingSeconds() {
        return includingSeconds;
    }

    public @NotNull CrontabField getSeconds() {
        return seconds;
    }

    public @NotNull CrontabField getMinutes() {
        return minutes;
    }

    public @NotNull CrontabField getHours() {
        return hours;
    }

    public @NotNull CrontabField getDays() {
        return days;
    }

    public @NotNull CrontabField getMonths() {
        return months;
    }

    public @NotNull CrontabField getDaysOfWeek() {
        return daysOfWeek;
    }

    private String render() {
        StringBuilder sb = new StringBuilder();
        if (includingSeconds) {
            sb.append(seconds).append(' ');
        }
        return sb.append(minutes).append(' ')
                .append(hours).append(' ')
                .append(days).append(' ')
                .append(months).append(' ')
                .append(daysOfWeek)
                .toString();
    }

    /**
     * Canonical numeric form, e.g. {@code 10,25,40 * * 1-2,5 *}. Parsing it with the same
     * options yields an equal schedule.
     */
    @Override
    public String toString() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CrontabSchedule)) return false;
        CrontabSchedule that = (CrontabSchedule) o;
        return includingSeconds == that.includingSeconds
                && seconds.equals(that.seconds)
                && minutes.equals(that.minutes)
                && hours.equals(that.hours)
                && days.equals(that.days)
                && months.equals(that.months)
                && daysOfWeek.equals(that.daysOfWeek);
    }

    @Override
    public int hashCode() {
        return Objects.hash(includingSeconds, seconds, minutes, hours, days, months, daysOfWeek);
    }
}

package com.example.syncedscheduler.schedule;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.scheduling.support.CronExpression;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Calendar-based recurrence: each field lists the values it matches, an empty field matches anything.
 * <p>
 * Seconds default to {@code 0} so that a rule fires once per matching minute.
 * Setting {@link Builder#year(int)} restricts the rule to that year. Setting
 * {@link Builder#recurs(boolean)} to {@code false} makes the local timer fire only
 * the first matching occurrence.
 * <pre>
 * var rule = RecurrenceRule.builder()
 *         .daysOfWeek(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)
 *         .hours(9)
 *         .minutes(30)
 *         .build();
 * </pre>
 */
@Getter
@EqualsAndHashCode(of = {"seconds", "minutes", "hours", "daysOfMonth", "months", "daysOfWeek", "year", "recurs"})
public final class RecurrenceRule {

    private final SortedSet<Integer> seconds;
    private final SortedSet<Integer> minutes;
    private final SortedSet<Integer> hours;
    private final SortedSet<Integer> daysOfMonth;
    private final SortedSet<Integer> months;
    private final Set<DayOfWeek> daysOfWeek;
    private final Integer year;

    @Getter(AccessLevel.NONE)
    private final boolean recurs;

    @Getter(AccessLevel.NONE)
    private final CronExpression cronExpression;

    private RecurrenceRule(Builder builder) {
        this.seconds = Collections.unmodifiableSortedSet(new TreeSet<>(builder.seconds.isEmpty() ? Set.of(0) : builder.seconds));
        this.minutes = Collections.unmodifiableSortedSet(new TreeSet<>(builder.minutes));
        this.hours = Collections.unmodifiableSortedSet(new TreeSet<>(builder.hours));
        this.daysOfMonth = Collections.unmodifiableSortedSet(new TreeSet<>(builder.daysOfMonth));
        this.months = Collections.unmodifiableSortedSet(new TreeSet<>(builder.months));
        this.daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(builder.daysOfWeek));
        this.year = builder.year;
        this.recurs = builder.recurs;
        this.cronExpression = CronExpression.parse(toCronExpression());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether the rule produces more than one occurrence
     */
    public boolean recurs() {
        return recurs;
    }

    /**
     * Next matching date strictly after {@code after}, in the zone of {@code after}.
     *
     * @return the next occurrence, or empty if the rule has none left
     */
    public Optional<ZonedDateTime> nextInvocationAfter(ZonedDateTime after) {
        if (year == null) {
            return Optional.ofNullable(cronExpression.next(after));
        }
        if (after.getYear() > year) {
            return Optional.empty();
        }

        var from = after;
        if (after.getYear() < year) {
            from = ZonedDateTime.of(year, 1, 1, 0, 0, 0, 0, after.getZone()).minusNanos(1);
        }
        var next = cronExpression.next(from);
        return next != null && next.getYear() == year ? Optional.of(next) : Optional.empty();
    }

    /**
     * Six-field Spring cron equivalent of the calendar fields. The year restriction is not part of it.
     */
    public String toCronExpression() {
        return String.join(" ",
                field(seconds),
                field(minutes),
                field(hours),
                field(daysOfMonth),
                field(months),
                daysOfWeek.isEmpty() ? "*" : daysOfWeek.stream()
                        .sorted()
                        .map(day -> day.name().substring(0, 3))
                        .collect(Collectors.joining(",")));
    }

    private static String field(SortedSet<Integer> values) {
        return values.isEmpty() ? "*" : values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        var description = toCronExpression();
        if (year != null) {
            description += " in " + year;
        }
        return recurs ? description : description + " (once)";
    }

    public static final class Builder {

        private final SortedSet<Integer> seconds = new TreeSet<>();
        private final SortedSet<Integer> minutes = new TreeSet<>();
        private final SortedSet<Integer> hours = new TreeSet<>();
        private final SortedSet<Integer> daysOfMonth = new TreeSet<>();
        private final SortedSet<Integer> months = new TreeSet<>();
        private final Set<DayOfWeek> daysOfWeek = EnumSet.noneOf(DayOfWeek.class);
        private Integer year;
        private boolean recurs = true;

        private Builder() {
        }

        public Builder seconds(int... values) {
            return addAll(seconds, values, 0, 59, "second");
        }

        public Builder minutes(int... values) {
            return addAll(minutes, values, 0, 59, "minute");
        }

        public Builder hours(int... values) {
            return addAll(hours, values, 0, 23, "hour");
        }

        public Builder daysOfMonth(int... values) {
            return addAll(daysOfMonth, values, 1, 31, "day of month");
        }

        /**
         * Months as 1 (January) to 12 (December)
         */
        public Builder months(int... values) {
            return addAll(months, values, 1, 12, "month");
        }

        public Builder daysOfWeek(DayOfWeek... values) {
            Collections.addAll(daysOfWeek, values);
            return this;
        }

        public Builder daysOfWeek(Collection<DayOfWeek> values) {
            daysOfWeek.addAll(values);
            return this;
        }

        public Builder year(int year) {
            this.year = year;
            return this;
        }

        public Builder recurs(boolean recurs) {
            this.recurs = recurs;
            return this;
        }

        public RecurrenceRule build() {
            return new RecurrenceRule(this);
        }

        private Builder addAll(SortedSet<Integer> target, int[] values, int min, int max, String field) {
            for (var value : values) {
                if (value < min || value > max) {
                    throw new IllegalArgumentException(String.format("Invalid %s %d, expected %d-%d", field, value, min, max));
                }
                target.add(value);
            }
            return this;
        }
    }
}

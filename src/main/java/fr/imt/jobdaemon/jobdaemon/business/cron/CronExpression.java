package fr.imt.jobdaemon.jobdaemon.business.cron;

import fr.imt.jobdaemon.jobdaemon.exception.InvalidScheduleException;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Optional;

/**
 * Standard five-field cron expression: minute, hour, day of month, month, day of week.
 * <p>
 * Supports {@code *}, lists, ranges, steps, month and weekday names, and 7 as Sunday.
 * When both day fields are restricted a time matches if either of them does,
 * as in Vixie cron. A field counts as restricted unless it starts with {@code *}.
 */
public final class CronExpression {

    private static final int SEARCH_YEARS = 5;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = CronField.MINUTE.parse(fields[0]);
        this.hours = CronField.HOUR.parse(fields[1]);
        this.daysOfMonth = CronField.DAY_OF_MONTH.parse(fields[2]);
        this.months = CronField.MONTH.parse(fields[3]);
        this.daysOfWeek = CronField.DAY_OF_WEEK.parse(fields[4]);
        this.dayOfMonthRestricted = !fields[2].startsWith("*");
        this.dayOfWeekRestricted = !fields[4].startsWith("*");
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException(
                    "Cron expression must have 5 fields, got " + fields.length + ": '" + expression + "'");
        }
        return new CronExpression(expression.trim(), fields);
    }

    public boolean matches(ZonedDateTime time) {
        return minutes.get(time.getMinute())
                && hours.get(time.getHour())
                && months.get(time.getMonthValue())
                && dayMatches(time);
    }

    /**
     * First minute strictly after {@code time} that matches, searching at most five years ahead.
     */
    public Optional<ZonedDateTime> nextAfter(ZonedDateTime time) {
        ZonedDateTime limit = time.plusYears(SEARCH_YEARS);
        ZonedDateTime candidate = time.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);

        while (candidate.isBefore(limit)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
            } else if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
            } else if (!hours.get(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            } else if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
            } else {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private boolean dayMatches(ZonedDateTime time) {
        boolean dom = daysOfMonth.get(time.getDayOfMonth());
        boolean dow = daysOfWeek.get(time.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return dom || dow;
        }
        return dom && dow;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}

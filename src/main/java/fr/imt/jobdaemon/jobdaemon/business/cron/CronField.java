package fr.imt.jobdaemon.jobdaemon.business.cron;

import fr.imt.jobdaemon.jobdaemon.exception.InvalidScheduleException;
import lombok.Getter;

import java.util.BitSet;
import java.util.List;

/**
 * One of the five fields of a cron expression together with its allowed range and names.
 */
@Getter
enum CronField {
    MINUTE("minute", 0, 59, List.of()),
    HOUR("hour", 0, 23, List.of()),
    DAY_OF_MONTH("day of month", 1, 31, List.of()),
    MONTH("month", 1, 12,
            List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC")),
    DAY_OF_WEEK("day of week", 0, 7, List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"));

    private final String label;
    private final int min;
    private final int max;
    private final List<String> names;

    CronField(String label, int min, int max, List<String> names) {
        this.label = label;
        this.min = min;
        this.max = max;
        this.names = names;
    }

    /**
     * Parses a comma separated list of values, ranges and steps into the set of matching values.
     */
    BitSet parse(String text) {
        BitSet values = new BitSet(max + 1);
        for (String part : text.split(",", -1)) {
            parsePart(part, values);
        }
        if (this == DAY_OF_WEEK && values.get(7)) {
            values.clear(7);
            values.set(0);
        }
        return values;
    }

    private void parsePart(String part, BitSet values) {
        if (part.isEmpty()) {
            throw invalid("empty list element");
        }
        String range = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            range = part.substring(0, slash);
            step = parseNumber(part.substring(slash + 1));
            if (step <= 0) {
                throw invalid("step must be positive in '" + part + "'");
            }
        }

        int from;
        int to;
        if ("*".equals(range)) {
            from = min;
            to = this == DAY_OF_WEEK ? 6 : max;
        } else if (range.indexOf('-') > 0) {
            String[] bounds = range.split("-", 2);
            from = parseValue(bounds[0]);
            to = parseValue(bounds[1]);
        } else {
            from = parseValue(range);
            to = slash >= 0 ? max : from;
        }
        if (from > to) {
            throw invalid("range '" + range + "' is reversed");
        }
        for (int value = from; value <= to; value += step) {
            values.set(value);
        }
    }

    private int parseValue(String token) {
        int index = names.indexOf(token.toUpperCase());
        int value;
        if (index >= 0) {
            value = this == MONTH ? index + 1 : index;
        } else {
            value = parseNumber(token);
        }
        if (value < min || value > max) {
            throw invalid("value " + value + " out of range " + min + "-" + max);
        }
        return value;
    }

    private int parseNumber(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException("Invalid " + label + " value '" + token + "'", e);
        }
    }

    private InvalidScheduleException invalid(String reason) {
        return new InvalidScheduleException("Invalid " + label + " field: " + reason);
    }
}

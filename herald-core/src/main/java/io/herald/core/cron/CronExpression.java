package io.herald.core.cron;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

public final class CronExpression {
    private static final int SEARCH_HORIZON_YEARS = 4;

    private final String expression;
    private final boolean[] minutes;
    private final boolean[] hours;
    private final boolean[] daysOfMonth;
    private final boolean[] months;
    private final boolean[] daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, List<SortedSet<Integer>> fields) {
        this.expression = expression;
        this.minutes = toMask(fields.get(0), CronField.MINUTE);
        this.hours = toMask(fields.get(1), CronField.HOUR);
        this.daysOfMonth = toMask(fields.get(2), CronField.DAY_OF_MONTH);
        this.months = toMask(fields.get(3), CronField.MONTH);
        this.daysOfWeek = toMask(fields.get(4), CronField.DAY_OF_WEEK);
        this.dayOfMonthRestricted = fields.get(2).size() < CronField.DAY_OF_MONTH.valueCount();
        this.dayOfWeekRestricted = fields.get(4).size() < CronField.DAY_OF_WEEK.valueCount();
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new MalformedExpressionException(String.valueOf(expression), "expression is empty");
        }
        String trimmed = expression.trim();
        String[] parts = trimmed.split("\\s+");
        if (parts.length != 5) {
            throw new MalformedExpressionException(trimmed, "expected 5 fields but found " + parts.length);
        }

        CronField[] order = CronField.values();
        List<SortedSet<Integer>> fields = new ArrayList<>(5);
        for (int i = 0; i < parts.length; i++) {
            fields.add(parseField(trimmed, parts[i], order[i]));
        }
        return new CronExpression(trimmed, fields);
    }

    /**
     * Computes the next fire time of {@code expression} in the named zone. Blank zone names mean UTC.
     */
    public static Instant calculateNextRun(String expression, Instant after, String timezone) {
        return parse(expression).nextRun(after, resolveZone(timezone));
    }

    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone, e);
        }
    }

    public String expression() {
        return expression;
    }

    public SortedSet<Integer> values(CronField field) {
        boolean[] mask = switch (field) {
            case MINUTE -> minutes;
            case HOUR -> hours;
            case DAY_OF_MONTH -> daysOfMonth;
            case MONTH -> months;
            case DAY_OF_WEEK -> daysOfWeek;
        };
        SortedSet<Integer> out = new TreeSet<>();
        for (int value = field.min(); value <= field.max(); value++) {
            if (mask[value]) {
                out.add(value);
            }
        }
        return Collections.unmodifiableSortedSet(out);
    }

    public boolean matches(ZonedDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime must not be null");
        return minutes[dateTime.getMinute()]
            && hours[dateTime.getHour()]
            && months[dateTime.getMonthValue()]
            && dayMatches(dateTime);
    }

    public Instant nextRun(Instant after, ZoneId zone) {
        Objects.requireNonNull(after, "after must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        ZonedDateTime candidate = after.atZone(zone).truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime horizon = candidate.plusYears(SEARCH_HORIZON_YEARS);
        while (candidate.isBefore(horizon)) {
            if (!months[candidate.getMonthValue()]) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours[candidate.getHour()]) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes[candidate.getMinute()]) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return candidate.toInstant();
        }
        throw new IllegalStateException(
            "No occurrence of '" + expression + "' within " + SEARCH_HORIZON_YEARS + " years after " + after
        );
    }

    public List<Instant> nextRuns(Instant after, ZoneId zone, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        List<Instant> runs = new ArrayList<>(count);
        Instant cursor = after;
        for (int i = 0; i < count; i++) {
            cursor = nextRun(cursor, zone);
            runs.add(cursor);
        }
        return runs;
    }

    private boolean dayMatches(ZonedDateTime dateTime) {
        boolean domMatch = daysOfMonth[dateTime.getDayOfMonth()];
        boolean dowMatch = daysOfWeek[dateTime.getDayOfWeek().getValue() % 7];
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return domMatch || dowMatch;
        }
        if (dayOfMonthRestricted) {
            return domMatch;
        }
        if (dayOfWeekRestricted) {
            return dowMatch;
        }
        return true;
    }

    private static SortedSet<Integer> parseField(String expression, String raw, CronField field) {
        SortedSet<Integer> values = new TreeSet<>();
        for (String part : raw.split(",", -1)) {
            if (part.isEmpty()) {
                throw new MalformedExpressionException(expression, "empty list element in " + field.label() + " field");
            }
            parsePart(expression, part, field, values);
        }
        if (field == CronField.DAY_OF_WEEK && values.remove(7)) {
            values.add(0);
        }
        if (values.isEmpty()) {
            throw new MalformedExpressionException(expression, field.label() + " field matches nothing");
        }
        return values;
    }

    private static void parsePart(String expression, String part, CronField field, SortedSet<Integer> values) {
        String rangeToken = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            rangeToken = part.substring(0, slash);
            step = parseNumber(expression, part.substring(slash + 1), field);
            if (step <= 0) {
                throw new MalformedExpressionException(expression, "step must be positive in " + field.label() + " field");
            }
        }

        int start;
        int end;
        if ("*".equals(rangeToken)) {
            start = field.min();
            end = field.max();
        } else if (rangeToken.indexOf('-') > 0) {
            int dash = rangeToken.indexOf('-');
            start = parseNumber(expression, rangeToken.substring(0, dash), field);
            end = parseNumber(expression, rangeToken.substring(dash + 1), field);
            if (start > end) {
                throw new MalformedExpressionException(
                    expression,
                    "range " + rangeToken + " is reversed in " + field.label() + " field"
                );
            }
        } else {
            if (slash >= 0) {
                throw new MalformedExpressionException(
                    expression,
                    "step requires '*' or a range in " + field.label() + " field: " + part
                );
            }
            start = parseNumber(expression, rangeToken, field);
            end = start;
        }

        checkBounds(expression, start, field);
        checkBounds(expression, end, field);
        for (int value = start; value <= end; value += step) {
            values.add(value);
        }
    }

    private static int parseNumber(String expression, String token, CronField field) {
        if (token.isEmpty()) {
            throw new MalformedExpressionException(expression, "missing number in " + field.label() + " field");
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                throw new MalformedExpressionException(
                    expression,
                    "'" + token + "' is not a number in " + field.label() + " field"
                );
            }
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new MalformedExpressionException(expression, "'" + token + "' is too large in " + field.label() + " field");
        }
    }

    private static void checkBounds(String expression, int value, CronField field) {
        if (value < field.min() || value > field.parseMax()) {
            throw new MalformedExpressionException(
                expression,
                value + " is outside " + field.min() + "-" + field.parseMax() + " in " + field.label() + " field"
            );
        }
    }

    private static boolean[] toMask(SortedSet<Integer> values, CronField field) {
        boolean[] mask = new boolean[field.max() + 1];
        for (int value : values) {
            mask[value] = true;
        }
        return mask;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CronExpression that)) {
            return false;
        }
        return Arrays.equals(minutes, that.minutes)
            && Arrays.equals(hours, that.hours)
            && Arrays.equals(daysOfMonth, that.daysOfMonth)
            && Arrays.equals(months, that.months)
            && Arrays.equals(daysOfWeek, that.daysOfWeek);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(minutes);
        result = 31 * result + Arrays.hashCode(hours);
        result = 31 * result + Arrays.hashCode(daysOfMonth);
        result = 31 * result + Arrays.hashCode(months);
        return 31 * result + Arrays.hashCode(daysOfWeek);
    }

    @Override
    public String toString() {
        return expression;
    }
}

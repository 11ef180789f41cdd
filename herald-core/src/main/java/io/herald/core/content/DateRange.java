package io.herald.core.content;

import io.herald.core.model.TemplateConfig;
import io.herald.core.model.TimeFrameUnit;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public record DateRange(Instant start, Instant end, String display) {
    private static final int DEFAULT_DAYS = 7;
    private static final DateTimeFormatter FULL_MONTH = DateTimeFormatter.ofPattern("MMMM d", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_MONTH = DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);
    private static final DateTimeFormatter SHORT_WITH_YEAR = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

    public static DateRange lookback(TemplateConfig config, Instant now, ZoneId zone) {
        ZonedDateTime end = now.atZone(zone);
        int amount = config == null || config.timeFrame() <= 0 ? DEFAULT_DAYS : config.timeFrame();
        TimeFrameUnit unit = config == null || config.timeFrame() <= 0 ? TimeFrameUnit.DAYS : config.timeFrameUnit();
        ZonedDateTime start = switch (unit) {
            case HOURS -> end.minusHours(amount);
            case DAYS -> end.minusDays(amount);
            case WEEKS -> end.minusWeeks(amount);
            case MONTHS -> end.minusMonths(amount);
        };
        return new DateRange(start.toInstant(), end.toInstant(), display(start, end));
    }

    static String display(ZonedDateTime start, ZonedDateTime end) {
        if (start.getYear() == end.getYear() && start.getMonth() == end.getMonth()) {
            return start.format(FULL_MONTH) + " - " + end.getDayOfMonth() + ", " + end.getYear();
        }
        if (start.getYear() == end.getYear()) {
            return start.format(SHORT_MONTH) + " - " + end.format(SHORT_MONTH) + ", " + end.getYear();
        }
        return start.format(SHORT_WITH_YEAR) + " - " + end.format(SHORT_WITH_YEAR);
    }
}

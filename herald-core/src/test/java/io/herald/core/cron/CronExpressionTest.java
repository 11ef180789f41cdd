package io.herald.core.cron;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class CronExpressionTest {
    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void shouldFireDailyAtNineInUtc() {
        CronExpression cron = CronExpression.parse("0 9 * * *");

        assertThat(cron.nextRun(Instant.parse("2026-01-15T08:30:00Z"), UTC))
            .isEqualTo(Instant.parse("2026-01-15T09:00:00Z"));
        assertThat(cron.nextRun(Instant.parse("2026-01-15T10:00:00Z"), UTC))
            .isEqualTo(Instant.parse("2026-01-16T09:00:00Z"));
    }

    @Test
    void nextRunShouldBeStrictlyAfterTheGivenInstant() {
        CronExpression cron = CronExpression.parse("0 9 * * *");

        assertThat(cron.nextRun(Instant.parse("2026-01-15T09:00:00Z"), UTC))
            .isEqualTo(Instant.parse("2026-01-16T09:00:00Z"));
        assertThat(cron.nextRun(Instant.parse("2026-01-15T08:59:59.999Z"), UTC))
            .isEqualTo(Instant.parse("2026-01-15T09:00:00Z"));
    }

    @Test
    void shouldExpandStepsOverTheWholeField() {
        CronExpression cron = CronExpression.parse("*/5 * * * *");

        assertThat(cron.values(CronField.MINUTE)).containsExactly(0, 5, 10, 15, 20, 25, 30, 35, 40, 45, 50, 55);
        assertThat(cron.nextRuns(Instant.parse("2026-01-15T10:02:00Z"), UTC, 3)).containsExactly(
            Instant.parse("2026-01-15T10:05:00Z"),
            Instant.parse("2026-01-15T10:10:00Z"),
            Instant.parse("2026-01-15T10:15:00Z")
        );
    }

    @Test
    void shouldParseListsRangesAndSteppedRanges() {
        CronExpression cron = CronExpression.parse("0,30 8-10 1-10/3 1,6 1-5");

        assertThat(cron.values(CronField.MINUTE)).containsExactly(0, 30);
        assertThat(cron.values(CronField.HOUR)).containsExactly(8, 9, 10);
        assertThat(cron.values(CronField.DAY_OF_MONTH)).containsExactly(1, 4, 7, 10);
        assertThat(cron.values(CronField.MONTH)).containsExactly(1, 6);
        assertThat(cron.values(CronField.DAY_OF_WEEK)).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void shouldTreatSevenAsSunday() {
        assertThat(CronExpression.parse("0 0 * * 7")).isEqualTo(CronExpression.parse("0 0 * * 0"));
        // 2026-01-04 is a Sunday
        assertThat(CronExpression.parse("0 0 * * 7").nextRun(Instant.parse("2026-01-01T00:00:00Z"), UTC))
            .isEqualTo(Instant.parse("2026-01-04T00:00:00Z"));
        assertThat(CronExpression.parse("0 0 * * 0-7").values(CronField.DAY_OF_WEEK)).hasSize(7);
    }

    @Test
    void shouldMatchOnlyTheGivenDateWhenDayOfWeekIsUnrestricted() {
        CronExpression cron = CronExpression.parse("30 9 15 1 *");

        assertThat(cron.nextRuns(Instant.parse("2026-01-01T00:00:00Z"), UTC, 2)).containsExactly(
            Instant.parse("2026-01-15T09:30:00Z"),
            Instant.parse("2027-01-15T09:30:00Z")
        );
    }

    @Test
    void shouldMatchEitherDayFieldWhenBothAreRestricted() {
        // Mondays in January 2026: 5, 12, 19, 26
        CronExpression cron = CronExpression.parse("0 9 15 * 1");

        assertThat(cron.nextRuns(Instant.parse("2026-01-12T10:00:00Z"), UTC, 3)).containsExactly(
            Instant.parse("2026-01-15T09:00:00Z"),
            Instant.parse("2026-01-19T09:00:00Z"),
            Instant.parse("2026-01-26T09:00:00Z")
        );
    }

    @Test
    void shouldFireOnMondaysOnly() {
        CronExpression cron = CronExpression.parse("0 9 * * 1");

        assertThat(cron.nextRuns(Instant.parse("2026-01-06T00:00:00Z"), UTC, 2)).containsExactly(
            Instant.parse("2026-01-12T09:00:00Z"),
            Instant.parse("2026-01-19T09:00:00Z")
        );
    }

    @Test
    void shouldEvaluateInTheScheduleTimezone() {
        Instant next = CronExpression.calculateNextRun("0 9 * * *", Instant.parse("2026-01-15T00:00:00Z"), "America/New_York");
        Instant summer = CronExpression.calculateNextRun("0 9 * * *", Instant.parse("2026-07-15T00:00:00Z"), "America/New_York");

        assertThat(next).isEqualTo(Instant.parse("2026-01-15T14:00:00Z"));
        assertThat(summer).isEqualTo(Instant.parse("2026-07-15T13:00:00Z"));
    }

    @Test
    void blankTimezoneShouldMeanUtc() {
        assertThat(CronExpression.resolveZone("")).isEqualTo(ZoneId.of("UTC"));
        assertThat(CronExpression.resolveZone(null)).isEqualTo(ZoneId.of("UTC"));
        assertThatThrownBy(() -> CronExpression.resolveZone("Mars/Olympus_Mons"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Mars/Olympus_Mons");
    }

    @Test
    void nextRunShouldAlwaysMatchTheExpression() {
        List<String> expressions = List.of("0 9 * * *", "*/15 * * * *", "30 9 15 1 *", "0 9 15 * 1", "5 4 * * 0", "0 0 1 */3 *");
        Instant from = Instant.parse("2026-03-07T17:43:12Z");
        ZoneId zone = ZoneId.of("Europe/Berlin");

        for (String expression : expressions) {
            CronExpression cron = CronExpression.parse(expression);
            Instant next = cron.nextRun(from, zone);
            assertThat(next).isAfter(from);
            assertThat(cron.matches(next.atZone(zone))).as(expression).isTrue();
        }
    }

    @Test
    void shouldRejectMalformedExpressions() {
        List<String> invalid = List.of(
            "",
            "* * * *",
            "* * * * * *",
            "60 * * * *",
            "* 24 * * *",
            "* * 0 * *",
            "* * * 13 *",
            "* * * * 8",
            "10-5 * * * *",
            "5/10 * * * *",
            "*/0 * * * *",
            "a * * * *",
            "1,,2 * * * *"
        );
        for (String expression : invalid) {
            assertThatThrownBy(() -> CronExpression.parse(expression))
                .as(expression)
                .isInstanceOf(MalformedExpressionException.class)
                .hasMessageStartingWith("Invalid cron expression");
        }
    }

    @Test
    void shouldGiveUpOnDatesThatNeverOccur() {
        CronExpression cron = CronExpression.parse("0 0 30 2 *");

        assertThatThrownBy(() -> cron.nextRun(Instant.parse("2026-01-01T00:00:00Z"), UTC))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No occurrence");
    }
}

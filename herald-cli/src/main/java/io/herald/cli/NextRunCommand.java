package io.herald.cli;

import io.herald.core.cron.CronExpression;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "next-run", description = "Print the upcoming fire times of a cron expression")
public final class NextRunCommand implements Callable<Integer> {
    private final Clock clock;

    @Parameters(index = "0", description = "Five-field cron expression, quoted")
    String expression;

    @Option(names = "--timezone", description = "IANA timezone the expression is evaluated in", defaultValue = "UTC")
    String timezone;

    @Option(names = "--from", description = "ISO-8601 instant to start from (default: now)")
    Instant from;

    @Option(names = "--count", description = "Number of fire times to print", defaultValue = "5")
    int count;

    public NextRunCommand() {
        this(Clock.systemUTC());
    }

    public NextRunCommand(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Integer call() {
        try {
            if (count < 1 || count > 100) {
                throw new IllegalArgumentException("--count must be between 1 and 100");
            }
            CronExpression cron = CronExpression.parse(expression);
            ZoneId zone = CronExpression.resolveZone(timezone);
            Instant start = from == null ? clock.instant() : from;
            List<Instant> runs = cron.nextRuns(start, zone, count);
            for (Instant run : runs) {
                System.out.println(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(run.atZone(zone)) + "  (" + run + ")");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("next-run failed: " + e.getMessage());
            return 1;
        }
    }
}

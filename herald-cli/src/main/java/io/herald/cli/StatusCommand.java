package io.herald.cli;

import io.herald.core.config.ConfigPaths;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.model.Schedule;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration, channels and schedules")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            HeraldConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.storage().workspace()));
            System.out.println("Storage backend: " + config.storage().backend());
            System.out.println("Scheduler enabled: " + config.scheduler().enabled());
            System.out.println("Check interval: " + config.scheduler().toOptions().checkInterval().toSeconds() + "s");
            System.out.println("Channels: " + String.join(", ", context.runtime().channels()));

            List<Schedule> schedules = context.runtime().schedules();
            System.out.println("Schedules: " + schedules.size());
            for (Schedule schedule : schedules) {
                System.out.printf(
                    "  %s  %-24s %-16s %-8s next=%s last=%s runs=%d ok=%d failed=%d%n",
                    schedule.id(),
                    schedule.name(),
                    schedule.cronExpression(),
                    schedule.enabled() ? "enabled" : "disabled",
                    schedule.nextRunAt() == null ? "-" : schedule.nextRunAt(),
                    schedule.lastRunStatus() == null ? "-" : schedule.lastRunStatus().wireName(),
                    schedule.runCount(),
                    schedule.successCount(),
                    schedule.failureCount()
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

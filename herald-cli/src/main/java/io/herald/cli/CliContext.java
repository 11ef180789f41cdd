package io.herald.cli;

import io.herald.core.config.ConfigService;
import io.herald.core.model.Delivery;
import io.herald.core.model.Schedule;
import java.nio.file.Path;
import java.util.List;

public record CliContext(ConfigService configService, Path configPath, HeraldRuntime runtime) {

    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, new HeraldRuntime() {
            @Override
            public int runScheduler() {
                throw new UnsupportedOperationException("scheduler is not configured");
            }

            @Override
            public Delivery trigger(String scheduleId) {
                throw new UnsupportedOperationException("scheduler is not configured");
            }

            @Override
            public List<Schedule> schedules() {
                return List.of();
            }

            @Override
            public List<String> channels() {
                return List.of();
            }
        });
    }
}

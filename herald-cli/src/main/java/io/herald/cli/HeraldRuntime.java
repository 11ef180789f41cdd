package io.herald.cli;

import io.herald.core.model.Delivery;
import io.herald.core.model.Schedule;
import java.util.List;

/**
 * The parts of a wired engine the commands drive. Built lazily by the application so that commands which only
 * touch config never open the store.
 */
public interface HeraldRuntime {

    /**
     * Runs the scheduler until the process is asked to shut down.
     *
     * @return process exit code
     */
    int runScheduler() throws Exception;

    Delivery trigger(String scheduleId) throws Exception;

    List<Schedule> schedules() throws Exception;

    List<String> channels();
}

package io.herald.core.scheduler;

import io.herald.core.model.DeliveryStatus;
import io.herald.core.model.Schedule;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {

    /**
     * Enabled schedules whose next run is at or before {@code now}, earliest first.
     */
    List<Schedule> findDue(Instant now) throws IOException;

    Optional<Schedule> findById(String id) throws IOException;

    List<Schedule> list() throws IOException;

    void save(Schedule schedule) throws IOException;

    /**
     * Records the outcome of a run and the next fire time. Bumps the run counter and the success or failure
     * counter matching {@code status}.
     */
    void updateRunStatus(String id, DeliveryStatus status, Instant lastRunAt, Instant nextRunAt) throws IOException;
}

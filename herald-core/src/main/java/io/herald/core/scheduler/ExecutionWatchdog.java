package io.herald.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interrupts a worker whose execution overruns its deadline. Once {@link #complete()} has been called the
 * worker is never interrupted.
 */
final class ExecutionWatchdog {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionWatchdog.class);

    private final Thread worker;
    private final String scheduleId;
    private boolean completed;
    private boolean expired;

    ExecutionWatchdog(Thread worker, String scheduleId) {
        this.worker = worker;
        this.scheduleId = scheduleId;
    }

    synchronized void expire() {
        if (completed) {
            return;
        }
        expired = true;
        LOG.warn("Execution of schedule {} exceeded its timeout; interrupting", scheduleId);
        worker.interrupt();
    }

    synchronized void complete() {
        completed = true;
    }

    synchronized boolean expired() {
        return expired;
    }
}

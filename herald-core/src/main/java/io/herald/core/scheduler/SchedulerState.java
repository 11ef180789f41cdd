package io.herald.core.scheduler;

public enum SchedulerState {
    IDLE,
    RUNNING,
    STOPPING
}

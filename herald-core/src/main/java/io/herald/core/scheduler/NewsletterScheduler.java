package io.herald.core.scheduler;

import io.herald.core.model.Delivery;
import io.herald.core.model.Schedule;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls for due schedules on a fixed interval and executes them on a bounded pool, each under its own timeout.
 *
 * <p>Lifecycle: {@code IDLE -> RUNNING -> STOPPING -> IDLE}. A schedule is never executed twice at the same time.
 */
public final class NewsletterScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(NewsletterScheduler.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final ScheduleRepository schedules;
    private final ScheduleRunner runner;
    private final SchedulerOptions options;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService watchdogTimer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private SchedulerState state = SchedulerState.IDLE;
    private ScheduledExecutorService ticker;
    private ExecutorService executionPool;

    public NewsletterScheduler(ScheduleRepository schedules, ScheduleRunner runner, SchedulerOptions options, Clock clock) {
        this.schedules = Objects.requireNonNull(schedules, "schedules must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.options = options == null ? SchedulerOptions.defaults() : options;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.watchdogTimer = Executors.newSingleThreadScheduledExecutor(threadFactory("herald-watchdog"));
    }

    public SchedulerOptions options() {
        return options;
    }

    public SchedulerState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts polling and returns immediately. The first pass runs right away.
     *
     * @throws IllegalStateException when the scheduler is already running or still stopping
     */
    public void start() {
        lock.lock();
        try {
            if (state != SchedulerState.IDLE) {
                throw new IllegalStateException("scheduler is already " + state.name().toLowerCase(Locale.ROOT));
            }
            state = SchedulerState.RUNNING;
            if (!options.enabled()) {
                LOG.info("Newsletter scheduler is disabled; no schedules will run");
                return;
            }
            executionPool = Executors.newFixedThreadPool(options.maxConcurrentDeliveries(), threadFactory("herald-exec"));
            ticker = Executors.newSingleThreadScheduledExecutor(threadFactory("herald-ticker"));
            ticker.scheduleAtFixedRate(
                this::tick,
                0,
                options.checkInterval().toMillis(),
                TimeUnit.MILLISECONDS
            );
            LOG.info(
                "Newsletter scheduler started: interval {}s, max {} concurrent, timeout {}s",
                options.checkInterval().toSeconds(),
                options.maxConcurrentDeliveries(),
                options.executionTimeout().toSeconds()
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops polling, cancels running executions and waits for the ticker to exit. Safe to call repeatedly; a call
     * that arrives while another caller is stopping waits for that stop to finish.
     */
    public void stop() {
        ScheduledExecutorService stoppingTicker;
        ExecutorService stoppingPool;
        lock.lock();
        try {
            if (state == SchedulerState.STOPPING) {
                awaitIdleLocked();
                return;
            }
            if (state != SchedulerState.RUNNING) {
                return;
            }
            state = SchedulerState.STOPPING;
            stoppingTicker = ticker;
            stoppingPool = executionPool;
            ticker = null;
            executionPool = null;
        } finally {
            lock.unlock();
        }

        try {
            if (stoppingTicker != null) {
                stoppingTicker.shutdownNow();
            }
            if (stoppingPool != null) {
                releaseUnstarted(stoppingPool.shutdownNow());
            }
            if (stoppingTicker != null && !stoppingTicker.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Scheduler ticker did not exit within {}s", SHUTDOWN_WAIT_SECONDS);
            }
            if (stoppingPool != null && !stoppingPool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Schedule executions did not finish within {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.lock();
            try {
                state = SchedulerState.IDLE;
                idle.signalAll();
            } finally {
                lock.unlock();
            }
            LOG.info("Newsletter scheduler stopped");
        }
    }

    /**
     * Blocks until the scheduler is back to idle.
     */
    public void awaitStop() throws InterruptedException {
        lock.lock();
        try {
            while (state != SchedulerState.IDLE) {
                idle.await();
            }
        } finally {
            lock.unlock();
        }
    }

    private void awaitIdleLocked() {
        try {
            while (state != SchedulerState.IDLE) {
                idle.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Executes one schedule immediately on the calling thread, outside the polling cycle.
     */
    public Delivery trigger(String scheduleId) throws IOException {
        Schedule schedule = schedules.findById(scheduleId)
            .orElseThrow(() -> new IllegalArgumentException("schedule not found: " + scheduleId));
        if (!inFlight.add(schedule.id())) {
            throw new IllegalStateException("schedule " + scheduleId + " is already executing");
        }
        LOG.info("Manual trigger for schedule {}", scheduleId);
        Delivery[] outcome = new Delivery[1];
        runGuarded(schedule, Delivery.TRIGGER_MANUAL, outcome);
        return outcome[0];
    }

    /**
     * One polling pass: dispatches every due schedule that is not already executing and waits for them all.
     *
     * @return number of executions dispatched
     */
    int checkAndExecute() throws InterruptedException {
        ExecutorService pool;
        lock.lock();
        try {
            pool = executionPool;
        } finally {
            lock.unlock();
        }
        if (pool == null) {
            return 0;
        }

        List<Schedule> due;
        try {
            due = schedules.findDue(clock.instant());
        } catch (IOException e) {
            LOG.error("Failed to query due schedules", e);
            return 0;
        }
        if (due.isEmpty()) {
            return 0;
        }
        LOG.debug("Found {} due schedule(s)", due.size());

        List<Dispatch> dispatched = new ArrayList<>(due.size());
        try {
            for (Schedule schedule : due) {
                if (!inFlight.add(schedule.id())) {
                    LOG.debug("Schedule {} is still executing; skipping", schedule.id());
                    continue;
                }
                Dispatch dispatch = new Dispatch(
                    schedule.id(),
                    () -> runGuarded(schedule, Delivery.TRIGGER_SCHEDULER, null)
                );
                try {
                    pool.execute(dispatch);
                } catch (RejectedExecutionException e) {
                    inFlight.remove(schedule.id());
                    LOG.warn("Scheduler is shutting down; schedule {} not dispatched", schedule.id());
                    break;
                }
                dispatched.add(dispatch);
            }

            for (Dispatch dispatch : dispatched) {
                try {
                    dispatch.get();
                } catch (ExecutionException e) {
                    LOG.error("Schedule {} execution failed", dispatch.scheduleId(), e.getCause());
                } catch (CancellationException e) {
                    LOG.debug("Schedule {} was withdrawn before it started", dispatch.scheduleId());
                }
            }
        } finally {
            // an interrupted pass must not leave queued schedules marked as executing
            releaseUnstarted(dispatched);
        }
        return dispatched.size();
    }

    /**
     * Withdraws dispatches that never started and frees their schedules. They stay due and run on a later pass.
     */
    private void releaseUnstarted(List<? extends Runnable> tasks) {
        for (Runnable task : tasks) {
            if (task instanceof Dispatch dispatch && dispatch.cancel(false)) {
                inFlight.remove(dispatch.scheduleId());
                LOG.warn("Schedule {} was not started before shutdown; it remains due", dispatch.scheduleId());
            }
        }
    }

    @Override
    public void close() {
        stop();
        watchdogTimer.shutdownNow();
    }

    private void tick() {
        if (state() != SchedulerState.RUNNING) {
            return;
        }
        try {
            checkAndExecute();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Scheduler pass interrupted");
        } catch (RuntimeException e) {
            LOG.error("Scheduler pass failed", e);
        }
    }

    private void runGuarded(Schedule schedule, String triggeredBy, Delivery[] outcome) {
        ExecutionWatchdog watchdog = new ExecutionWatchdog(Thread.currentThread(), schedule.id());
        ScheduledFuture<?> timer = watchdogTimer.schedule(
            watchdog::expire,
            options.executionTimeout().toMillis(),
            TimeUnit.MILLISECONDS
        );
        try {
            Delivery delivery = runner.execute(schedule, triggeredBy);
            if (outcome != null) {
                outcome[0] = delivery;
            }
        } catch (RuntimeException e) {
            LOG.error("Schedule {} execution failed", schedule.id(), e);
        } finally {
            watchdog.complete();
            timer.cancel(false);
            if (watchdog.expired()) {
                // clear the timeout interrupt so it does not leak into the next task on this thread
                Thread.interrupted();
            }
            inFlight.remove(schedule.id());
        }
    }

    /**
     * Queued execution of one schedule. Whoever cancels it before it starts owns releasing its in-flight mark.
     */
    private static final class Dispatch extends FutureTask<Void> {
        private final String scheduleId;

        Dispatch(String scheduleId, Runnable body) {
            super(body, null);
            this.scheduleId = scheduleId;
        }

        String scheduleId() {
            return scheduleId;
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

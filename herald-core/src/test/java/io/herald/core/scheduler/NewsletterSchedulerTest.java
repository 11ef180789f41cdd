package io.herald.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.herald.core.content.ContentData;
import io.herald.core.content.ContentResolver;
import io.herald.core.delivery.ChannelRegistry;
import io.herald.core.delivery.DeliveryChannel;
import io.herald.core.delivery.DeliveryManager;
import io.herald.core.delivery.DeliveryManagerConfig;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.ContentType;
import io.herald.core.model.Delivery;
import io.herald.core.model.DeliveryStatus;
import io.herald.core.model.NewsletterTemplate;
import io.herald.core.model.Recipient;
import io.herald.core.model.Schedule;
import io.herald.core.store.InMemoryNewsletterStore;
import io.herald.core.template.QuteTemplateRenderer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NewsletterSchedulerTest {
    private static final Instant NOW = Instant.parse("2026-03-15T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryNewsletterStore store;
    private GatedChannel channel;
    private NewsletterScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryNewsletterStore();
        channel = new GatedChannel();
        store.saveTemplate(new NewsletterTemplate(
            "t-1", "Plain", ContentType.CUSTOM, "News from {server_name}", "<p>hello</p>", "", null, 1, true
        ));
    }

    @AfterEach
    void tearDown() {
        channel.release();
        if (scheduler != null) {
            scheduler.close();
        }
    }

    @Test
    void shouldExecuteDueSchedulesOnTheFirstPass() throws Exception {
        channel.release();
        store.save(dueSchedule("s-1"));
        store.save(dueSchedule("s-2"));
        store.save(dueSchedule("s-3").withEnabled(false));
        scheduler = scheduler(options(Duration.ofMinutes(5)));

        scheduler.start();

        awaitCondition(() -> runCount("s-1") == 1 && runCount("s-2") == 1);
        assertThat(runCount("s-3")).isZero();
        assertThat(store.listDeliveries(null, 0))
            .extracting(Delivery::triggeredBy)
            .containsOnly(Delivery.TRIGGER_SCHEDULER);
        assertThat(store.findById("s-1").orElseThrow().nextRunAt()).isEqualTo(Instant.parse("2026-03-15T09:30:00Z"));

        scheduler.stop();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
    }

    @Test
    void shouldNotExecuteAScheduleThatIsStillRunning() throws Exception {
        store.save(dueSchedule("s-1"));
        scheduler = scheduler(options(Duration.ofMinutes(5)));

        scheduler.start();
        assertThat(channel.entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(scheduler.checkAndExecute()).isZero();
        assertThatThrownBy(() -> scheduler.trigger("s-1"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already executing");

        channel.release();
        awaitCondition(() -> runCount("s-1") == 1);
        assertThat(channel.calls.get()).isEqualTo(1);
    }

    @Test
    void lifecycleShouldRejectDoubleStartAndTolerateRepeatedStop() throws Exception {
        scheduler = scheduler(options(Duration.ofMinutes(5)));

        scheduler.stop();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);

        scheduler.start();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
        assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class).hasMessageContaining("running");

        Thread stopper = new Thread(scheduler::stop);
        stopper.start();
        scheduler.awaitStop();
        stopper.join();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);

        scheduler.stop();
        scheduler.start();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
    }

    @Test
    void stopRightAfterStartShouldLeaveNothingRunning() throws Exception {
        channel.release();
        scheduler = scheduler(options(Duration.ofSeconds(10)));

        scheduler.start();
        scheduler.stop();
        store.save(dueSchedule("s-1"));
        Thread.sleep(200);

        assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
        assertThat(scheduler.checkAndExecute()).isZero();
        assertThat(runCount("s-1")).isZero();
        assertThat(channel.calls.get()).isZero();
    }

    @Test
    void schedulesQueuedAtStopShouldStayRunnable() throws Exception {
        store.save(dueSchedule("s-1"));
        store.save(dueSchedule("s-2"));
        scheduler = scheduler(new SchedulerOptions(true, Duration.ofMinutes(5), 1, Duration.ofMinutes(1)));

        scheduler.start();
        assertThat(channel.entered.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.stop();

        assertThat(channel.calls.get()).isEqualTo(1);
        assertThat(runCount("s-1") + runCount("s-2")).isEqualTo(1);
        String queued = runCount("s-1") == 0 ? "s-1" : "s-2";

        channel.release();
        Delivery delivery = scheduler.trigger(queued);
        assertThat(delivery.status()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(runCount(queued)).isEqualTo(1);
    }

    @Test
    void queuedScheduleShouldRunAfterRestart() throws Exception {
        store.save(dueSchedule("s-1"));
        store.save(dueSchedule("s-2"));
        scheduler = scheduler(new SchedulerOptions(true, Duration.ofMinutes(5), 1, Duration.ofMinutes(1)));

        scheduler.start();
        assertThat(channel.entered.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.stop();
        channel.release();

        scheduler.start();
        awaitCondition(() -> runCount("s-1") == 1 && runCount("s-2") == 1);
        assertThat(channel.calls.get()).isEqualTo(2);
    }

    @Test
    void concurrentStopShouldWaitForTheFirstStopToFinish() throws Exception {
        channel.ignoreInterrupts();
        store.save(dueSchedule("s-1"));
        scheduler = scheduler(options(Duration.ofMinutes(5)));
        scheduler.start();
        assertThat(channel.entered.await(5, TimeUnit.SECONDS)).isTrue();

        Thread first = new Thread(scheduler::stop);
        first.start();
        awaitCondition(() -> scheduler.state() == SchedulerState.STOPPING);
        AtomicBoolean secondReturned = new AtomicBoolean();
        Thread second = new Thread(() -> {
            scheduler.stop();
            secondReturned.set(true);
        });
        second.start();

        Thread.sleep(200);
        assertThat(secondReturned).isFalse();

        channel.release();
        first.join(5_000);
        second.join(5_000);
        assertThat(secondReturned).isTrue();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
    }

    @Test
    void disabledSchedulerShouldNotPoll() throws Exception {
        channel.release();
        store.save(dueSchedule("s-1"));
        scheduler = scheduler(new SchedulerOptions(false, Duration.ofSeconds(10), 2, Duration.ofMinutes(1)));

        scheduler.start();

        assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
        assertThat(scheduler.checkAndExecute()).isZero();
        assertThat(runCount("s-1")).isZero();
        assertThat(channel.calls.get()).isZero();
    }

    @Test
    void triggerShouldRunImmediatelyWithoutStarting() throws Exception {
        channel.release();
        store.save(dueSchedule("s-1").withNextRunAt(NOW.plusSeconds(86_400)));
        scheduler = scheduler(options(Duration.ofMinutes(5)));

        Delivery delivery = scheduler.trigger("s-1");

        assertThat(delivery.status()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(delivery.triggeredBy()).isEqualTo(Delivery.TRIGGER_MANUAL);
        assertThat(delivery.renderedSubject()).isEqualTo("News from Media Server");
        assertThat(runCount("s-1")).isEqualTo(1);
        assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
        assertThatThrownBy(() -> scheduler.trigger("nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("schedule not found: nope");
    }

    @Test
    void overrunningExecutionShouldBeCancelled() throws Exception {
        store.save(dueSchedule("s-1"));
        scheduler = scheduler(new SchedulerOptions(true, Duration.ofSeconds(10), 1, Duration.ofMillis(200)));

        Delivery delivery = scheduler.trigger("s-1");

        assertThat(delivery.status()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(delivery.errorMessage()).contains("cancelled");
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
        Schedule after = store.findById("s-1").orElseThrow();
        assertThat(after.failureCount()).isEqualTo(1);
        assertThat(after.nextRunAt()).isEqualTo(Instant.parse("2026-03-15T09:30:00Z"));
    }

    private NewsletterScheduler scheduler(SchedulerOptions options) {
        ChannelRegistry registry = new ChannelRegistry();
        registry.register(channel);
        DeliveryManagerConfig deliveryConfig = new DeliveryManagerConfig(0, Duration.ofMillis(1), Duration.ofMillis(1), 2);
        ContentResolver resolver = (type, config, userId, zone) ->
            new ContentData("Media Server", "", "", "", NOW, null, Map.of(), List.of());
        ScheduleRunner runner = new ScheduleRunner(
            store,
            store,
            store,
            resolver,
            new QuteTemplateRenderer(),
            new DeliveryManager(registry, deliveryConfig, CLOCK),
            "Media Server",
            CLOCK
        );
        return new NewsletterScheduler(store, runner, options, CLOCK);
    }

    private static SchedulerOptions options(Duration interval) {
        return new SchedulerOptions(true, interval, 2, Duration.ofMinutes(1));
    }

    private static Schedule dueSchedule(String id) {
        return Schedule.create(
            id,
            "Schedule " + id,
            "t-1",
            "30 9 * * *",
            "UTC",
            List.of(Recipient.email("reader@example.com")),
            List.of("webhook"),
            Map.of()
        ).withNextRunAt(NOW);
    }

    private int runCount(String id) {
        return store.findById(id).map(Schedule::runCount).orElse(-1);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    /**
     * Holds every send until {@link #release()} is called, or until interrupted unless told to ignore interrupts.
     */
    private static final class GatedChannel implements DeliveryChannel {
        private final CountDownLatch gate = new CountDownLatch(1);
        private final CountDownLatch entered = new CountDownLatch(1);
        private final AtomicInteger calls = new AtomicInteger();
        private volatile boolean ignoreInterrupts;

        void release() {
            gate.countDown();
        }

        void ignoreInterrupts() {
            ignoreInterrupts = true;
        }

        @Override
        public String name() {
            return "webhook";
        }

        @Override
        public boolean supportsHtml() {
            return true;
        }

        @Override
        public int maxContentLength() {
            return 0;
        }

        @Override
        public void validate(ChannelConfig config) {
        }

        @Override
        public DeliveryResult send(SendParams params) {
            calls.incrementAndGet();
            entered.countDown();
            boolean interrupted = false;
            while (true) {
                try {
                    gate.await();
                    break;
                } catch (InterruptedException e) {
                    if (!ignoreInterrupts) {
                        Thread.currentThread().interrupt();
                        return DeliveryResult.failure(name(), params.recipient(), ErrorCode.CANCELLED, "interrupted");
                    }
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return DeliveryResult.success(name(), params.recipient());
        }
    }
}

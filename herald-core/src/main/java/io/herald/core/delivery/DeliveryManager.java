package io.herald.core.delivery;

import io.herald.core.model.ChannelConfig;
import io.herald.core.model.Recipient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a rendered newsletter out to every recipient on every requested channel and folds the per-unit
 * outcomes into one {@link DeliveryReport}.
 *
 * <p>At most {@code parallelism} units run at once. Transient failures are retried with exponential backoff;
 * interrupting the calling thread cancels the outstanding units and returns what completed so far.
 */
public final class DeliveryManager {
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryManager.class);
    private static final Duration CANCEL_GRACE = Duration.ofSeconds(2);

    private final ChannelRegistry registry;
    private final DeliveryManagerConfig config;
    private final Clock clock;

    public DeliveryManager(ChannelRegistry registry, DeliveryManagerConfig config) {
        this(registry, config, Clock.systemUTC());
    }

    public DeliveryManager(ChannelRegistry registry, DeliveryManagerConfig config, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = config == null ? DeliveryManagerConfig.defaults() : config;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DeliveryManagerConfig config() {
        return config;
    }

    /**
     * Rejects requests that can never be delivered. A request with neither recipients nor channels is valid and
     * delivers nothing.
     */
    public void validate(DeliveryRequest request) throws DeliveryRequestException {
        if (request == null) {
            throw new DeliveryRequestException("delivery request must not be null");
        }
        if (request.deliveryId() == null || request.deliveryId().isBlank()) {
            throw new DeliveryRequestException("delivery request is missing a delivery id");
        }
        if (request.recipients().isEmpty() && !request.channels().isEmpty()) {
            throw new DeliveryRequestException("delivery " + request.deliveryId() + " has channels but no recipients");
        }
        if (request.channels().isEmpty() && !request.recipients().isEmpty()) {
            throw new DeliveryRequestException("delivery " + request.deliveryId() + " has recipients but no channels");
        }
    }

    public DeliveryReport deliver(DeliveryRequest request) throws DeliveryRequestException {
        validate(request);

        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        if (request.recipients().isEmpty() && request.channels().isEmpty()) {
            return DeliveryReport.of(request.deliveryId(), 0, List.of(), startedAt, clock.instant(), Duration.ZERO);
        }

        List<Unit> units = expand(request);
        DeliveryResult[] slots = new DeliveryResult[units.size()];
        int workers = Math.min(config.parallelism(), units.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory(request.deliveryId()));
        CompletionService<DeliveryResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<DeliveryResult>, Unit> outstanding = new HashMap<>();

        LOG.debug(
            "Delivering {} to {} recipient(s) over {} channel(s) with {} worker(s)",
            request.deliveryId(),
            request.recipients().size(),
            request.channels().size(),
            workers
        );
        try {
            for (Unit unit : units) {
                outstanding.put(completion.submit(() -> deliverUnit(request, unit)), unit);
            }
            while (!outstanding.isEmpty()) {
                Future<DeliveryResult> done = completion.take();
                Unit unit = outstanding.remove(done);
                slots[unit.index()] = resultOf(done, unit);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            drainAfterCancel(request.deliveryId(), pool, completion, outstanding, slots);
            Thread.currentThread().interrupt();
            for (Unit unit : outstanding.values()) {
                slots[unit.index()] = cancelled(unit, "delivery cancelled before completion");
            }
            LOG.warn("Delivery {} cancelled with {} unit(s) outstanding", request.deliveryId(), outstanding.size());
        } finally {
            pool.shutdownNow();
        }

        List<DeliveryResult> results = new ArrayList<>(slots.length);
        for (int i = 0; i < slots.length; i++) {
            results.add(slots[i] == null ? cancelled(units.get(i), "delivery cancelled before dispatch") : slots[i]);
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        DeliveryReport report = DeliveryReport.of(
            request.deliveryId(),
            units.size(),
            results,
            startedAt,
            clock.instant(),
            duration
        );
        LOG.info(
            "Delivery {} finished {}: {}/{} succeeded in {} ms",
            report.deliveryId(),
            report.status().wireName(),
            report.successfulDeliveries(),
            report.totalRecipients(),
            duration.toMillis()
        );
        return report;
    }

    /**
     * Returns a problem description per channel whose configuration is unusable. Valid channels are absent.
     */
    public Map<String, String> validateChannelConfigs(List<String> channels, Map<String, ChannelConfig> configs) {
        Map<String, String> problems = new LinkedHashMap<>();
        if (channels == null) {
            return problems;
        }
        Map<String, ChannelConfig> safeConfigs = configs == null ? Map.of() : configs;
        for (String name : channels) {
            Optional<DeliveryChannel> channel = registry.find(name);
            if (channel.isEmpty()) {
                problems.put(name, "unknown channel: " + name);
                continue;
            }
            ChannelConfig channelConfig = safeConfigs.getOrDefault(name, ChannelConfig.empty());
            try {
                channel.get().validate(channelConfig);
            } catch (IllegalArgumentException e) {
                problems.put(name, e.getMessage());
            }
        }
        return problems;
    }

    public List<String> availableChannels() {
        return registry.names();
    }

    Duration backoffDelay(int attempt, Duration retryAfter) {
        if (retryAfter != null && !retryAfter.isZero() && !retryAfter.isNegative()) {
            return retryAfter.compareTo(config.maxDelay()) > 0 ? config.maxDelay() : retryAfter;
        }
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        Duration delay = config.baseDelay().multipliedBy(1L << exponent);
        return delay.compareTo(config.maxDelay()) > 0 ? config.maxDelay() : delay;
    }

    private DeliveryResult deliverUnit(DeliveryRequest request, Unit unit) {
        Optional<DeliveryChannel> channel = registry.find(unit.channel());
        if (channel.isEmpty()) {
            return DeliveryResult.failure(
                unit.channel(),
                unit.recipient(),
                ErrorCode.INVALID_CONFIG,
                "unknown channel: " + unit.channel()
            ).finish(1, clock.instant());
        }

        SendParams params = new SendParams(
            request.deliveryId(),
            request.scheduleId(),
            unit.recipient(),
            request.subject(),
            request.html(),
            request.text(),
            request.configFor(unit.channel()),
            request.metadata()
        );

        int attempt = 0;
        DeliveryResult result;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                result = cancelled(unit, "delivery cancelled");
                break;
            }
            attempt++;
            result = send(channel.get(), params);
            if (result.success() || !result.retryable() || attempt > config.maxRetries()) {
                break;
            }
            Duration delay = backoffDelay(attempt, result.retryAfter());
            LOG.debug(
                "Retrying {} -> {} after {} ms (attempt {} failed: {})",
                unit.channel(),
                unit.recipient(),
                delay.toMillis(),
                attempt,
                result.errorCode()
            );
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = cancelled(unit, "delivery cancelled during retry backoff");
                break;
            }
        }
        if (!result.success()) {
            LOG.debug(
                "Unit {} -> {} failed after {} attempt(s): {} {}",
                unit.channel(),
                unit.recipient(),
                attempt,
                result.errorCode(),
                result.errorMessage()
            );
        }
        return result.finish(Math.max(attempt, 1), clock.instant());
    }

    private DeliveryResult send(DeliveryChannel channel, SendParams params) {
        try {
            DeliveryResult result = channel.send(params);
            if (result == null) {
                return DeliveryResult.failure(
                    channel.name(),
                    params.recipient(),
                    ErrorCode.UNKNOWN,
                    "channel returned no result"
                );
            }
            return result;
        } catch (RuntimeException e) {
            LOG.warn("Channel {} threw while sending to {}", channel.name(), params.recipient(), e);
            return DeliveryResult.failure(channel.name(), params.recipient(), ErrorCode.UNKNOWN, String.valueOf(e.getMessage()));
        }
    }

    private DeliveryResult resultOf(Future<DeliveryResult> done, Unit unit) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Delivery unit {} -> {} failed unexpectedly", unit.channel(), unit.recipient(), cause);
            return DeliveryResult.failure(unit.channel(), unit.recipient(), ErrorCode.UNKNOWN, String.valueOf(cause.getMessage()))
                .finish(1, clock.instant());
        }
    }

    /**
     * Gives interrupted units a short grace period to stop and keeps the real result of any that finished.
     * Units still running afterwards are abandoned and reported as cancelled.
     */
    private void drainAfterCancel(
        String deliveryId,
        ExecutorService pool,
        CompletionService<DeliveryResult> completion,
        Map<Future<DeliveryResult>, Unit> outstanding,
        DeliveryResult[] slots
    ) {
        try {
            if (!pool.awaitTermination(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Delivery {} abandoned unit(s) that ignored cancellation", deliveryId);
            }
            Future<DeliveryResult> done;
            while ((done = completion.poll()) != null) {
                Unit unit = outstanding.remove(done);
                if (unit != null) {
                    slots[unit.index()] = resultOf(done, unit);
                }
            }
        } catch (InterruptedException e) {
            LOG.debug("Delivery {} stopped waiting for cancelled units", deliveryId);
        }
    }

    private DeliveryResult cancelled(Unit unit, String message) {
        return DeliveryResult.failure(unit.channel(), unit.recipient(), ErrorCode.CANCELLED, message)
            .finish(1, clock.instant());
    }

    private List<Unit> expand(DeliveryRequest request) {
        List<Unit> units = new ArrayList<>(request.unitCount());
        for (String channel : request.channels()) {
            for (Recipient recipient : request.recipients()) {
                units.add(new Unit(units.size(), channel, recipient));
            }
        }
        return units;
    }

    private static ThreadFactory threadFactory(String deliveryId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "herald-delivery-" + deliveryId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Unit(int index, String channel, Recipient recipient) {
    }
}

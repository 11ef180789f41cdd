package io.herald.core.scheduler;

import io.herald.core.content.ContentData;
import io.herald.core.content.ContentResolutionException;
import io.herald.core.content.ContentResolver;
import io.herald.core.cron.CronExpression;
import io.herald.core.delivery.DeliveryManager;
import io.herald.core.delivery.DeliveryMetadata;
import io.herald.core.delivery.DeliveryReport;
import io.herald.core.delivery.DeliveryRequest;
import io.herald.core.delivery.DeliveryRequestException;
import io.herald.core.model.Delivery;
import io.herald.core.model.DeliveryStatus;
import io.herald.core.model.NewsletterTemplate;
import io.herald.core.model.Recipient;
import io.herald.core.model.RecipientType;
import io.herald.core.model.Schedule;
import io.herald.core.model.TemplateConfig;
import io.herald.core.template.RenderedContent;
import io.herald.core.template.TemplateRenderException;
import io.herald.core.template.TemplateRenderer;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one schedule end to end: records the delivery, resolves and renders content, hands it to the
 * {@link DeliveryManager}, and always moves the schedule on to its next fire time.
 */
public final class ScheduleRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleRunner.class);

    private final ScheduleRepository schedules;
    private final TemplateRepository templates;
    private final DeliveryRepository deliveries;
    private final ContentResolver contentResolver;
    private final TemplateRenderer renderer;
    private final DeliveryManager deliveryManager;
    private final String serverName;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public ScheduleRunner(
        ScheduleRepository schedules,
        TemplateRepository templates,
        DeliveryRepository deliveries,
        ContentResolver contentResolver,
        TemplateRenderer renderer,
        DeliveryManager deliveryManager,
        String serverName,
        Clock clock
    ) {
        this(
            schedules,
            templates,
            deliveries,
            contentResolver,
            renderer,
            deliveryManager,
            serverName,
            clock,
            () -> UUID.randomUUID().toString()
        );
    }

    public ScheduleRunner(
        ScheduleRepository schedules,
        TemplateRepository templates,
        DeliveryRepository deliveries,
        ContentResolver contentResolver,
        TemplateRenderer renderer,
        DeliveryManager deliveryManager,
        String serverName,
        Clock clock,
        Supplier<String> idGenerator
    ) {
        this.schedules = Objects.requireNonNull(schedules, "schedules must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.deliveries = Objects.requireNonNull(deliveries, "deliveries must not be null");
        this.contentResolver = Objects.requireNonNull(contentResolver, "contentResolver must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.deliveryManager = Objects.requireNonNull(deliveryManager, "deliveryManager must not be null");
        this.serverName = serverName == null ? "" : serverName;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
    }

    public Delivery execute(Schedule schedule, String triggeredBy) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Instant startedAt = clock.instant();
        String primaryChannel = schedule.channels().isEmpty() ? "" : schedule.channels().get(0);
        Delivery delivery = Delivery.pending(idGenerator.get(), schedule, primaryChannel, startedAt, triggeredBy);
        LOG.info("Executing schedule {} ({}) as delivery {}", schedule.id(), schedule.name(), delivery.id());

        try {
            deliveries.createDelivery(delivery);
        } catch (IOException e) {
            LOG.error("Failed to record delivery {} for schedule {}; skipping send", delivery.id(), schedule.id(), e);
            delivery = delivery.failed("failed to record delivery: " + e.getMessage(), clock.instant());
            advance(schedule, delivery.status(), startedAt);
            return delivery;
        }

        try {
            delivery = run(schedule, delivery);
        } catch (RuntimeException e) {
            LOG.error("Schedule {} failed unexpectedly", schedule.id(), e);
            delivery = fail(delivery, "unexpected error: " + e.getMessage());
        } finally {
            DeliveryStatus outcome = delivery.status().terminal() ? delivery.status() : DeliveryStatus.FAILED;
            advance(schedule, outcome, startedAt);
        }
        return delivery;
    }

    private Delivery run(Schedule schedule, Delivery pending) {
        NewsletterTemplate template;
        try {
            Optional<NewsletterTemplate> found = templates.findTemplate(schedule.templateId());
            if (found.isEmpty()) {
                return fail(pending, "template not found: " + schedule.templateId());
            }
            template = found.get();
        } catch (IOException e) {
            return fail(pending, "failed to load template " + schedule.templateId() + ": " + e.getMessage());
        }

        TemplateConfig config = schedule.configOverrides() != null ? schedule.configOverrides() : template.defaultConfig();
        boolean personalized = template.type().requiresUser() || (config != null && config.personalizeForUser());
        String userId = personalized ? firstUserId(schedule) : null;

        ContentData content;
        try {
            content = contentResolver.resolve(template.type(), config, userId, zoneOf(schedule));
        } catch (ContentResolutionException e) {
            return fail(pending, "content resolution failed: " + e.getMessage());
        }
        if (!content.warnings().isEmpty()) {
            LOG.warn("Schedule {} resolved content with warnings: {}", schedule.id(), content.warnings());
        }

        RenderedContent rendered;
        try {
            rendered = renderer.render(template, content);
        } catch (TemplateRenderException e) {
            return fail(pending, "template rendering failed: " + e.getMessage());
        }
        if (Thread.currentThread().isInterrupted()) {
            return fail(pending, "execution cancelled before sending");
        }

        DeliveryRequest request = new DeliveryRequest(
            pending.id(),
            schedule.id(),
            rendered.subject(),
            rendered.html(),
            rendered.text(),
            schedule.recipients(),
            schedule.channels(),
            schedule.channelConfigs(),
            new DeliveryMetadata(schedule.name(), serverName, content.unsubscribeUrl())
        );
        try {
            deliveryManager.validate(request);
        } catch (DeliveryRequestException e) {
            return fail(pending, "delivery rejected: " + e.getMessage());
        }
        Delivery sending = pending.sending(template.version(), rendered.subject(), rendered.bodySize(), request.unitCount());
        persist(sending);

        DeliveryReport report;
        try {
            report = deliveryManager.deliver(request);
        } catch (DeliveryRequestException e) {
            return fail(sending, "delivery rejected: " + e.getMessage());
        }

        String error = report.failureSummary();
        if (Thread.currentThread().isInterrupted()) {
            error = "execution cancelled or timed out" + (error == null ? "" : "; " + error);
        }
        Delivery completed = sending.completed(
            report.status(),
            report.successfulDeliveries(),
            report.failedDeliveries(),
            clock.instant(),
            error
        );
        persist(completed);
        LOG.info(
            "Schedule {} delivery {} {}: {}/{} delivered",
            schedule.id(),
            completed.id(),
            completed.status().wireName(),
            completed.recipientsDelivered(),
            completed.recipientsTotal()
        );
        return completed;
    }

    private Delivery fail(Delivery delivery, String message) {
        String error = message;
        if (Thread.currentThread().isInterrupted() && !message.contains("cancelled")) {
            error = message + " (execution cancelled or timed out)";
        }
        LOG.warn("Delivery {} for schedule {} failed: {}", delivery.id(), delivery.scheduleId(), error);
        Delivery failed = delivery.failed(error, clock.instant());
        persist(failed);
        return failed;
    }

    private void persist(Delivery delivery) {
        try {
            deliveries.updateDelivery(delivery);
        } catch (IOException e) {
            LOG.error("Failed to update delivery {} to {}", delivery.id(), delivery.status().wireName(), e);
        }
    }

    private void advance(Schedule schedule, DeliveryStatus status, Instant startedAt) {
        Instant nextRunAt = null;
        try {
            nextRunAt = CronExpression.calculateNextRun(schedule.cronExpression(), clock.instant(), schedule.timezone());
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Schedule {} has an unusable cron expression '{}': {}", schedule.id(), schedule.cronExpression(), e.getMessage());
        }
        try {
            schedules.updateRunStatus(schedule.id(), status, startedAt, nextRunAt);
        } catch (IOException e) {
            LOG.error("Failed to update run status of schedule {}", schedule.id(), e);
        }
    }

    private ZoneId zoneOf(Schedule schedule) {
        try {
            return CronExpression.resolveZone(schedule.timezone());
        } catch (IllegalArgumentException e) {
            LOG.warn("Schedule {} has unknown timezone '{}', using UTC", schedule.id(), schedule.timezone());
            return ZoneId.of("UTC");
        }
    }

    private static String firstUserId(Schedule schedule) {
        for (Recipient recipient : schedule.recipients()) {
            if (recipient.type() == RecipientType.USER && !recipient.target().isBlank()) {
                return recipient.target();
            }
        }
        return null;
    }
}

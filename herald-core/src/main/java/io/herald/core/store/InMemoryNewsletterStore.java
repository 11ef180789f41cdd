package io.herald.core.store;

import io.herald.core.delivery.channel.InAppNotification;
import io.herald.core.delivery.channel.InAppNotificationStore;
import io.herald.core.model.Delivery;
import io.herald.core.model.DeliveryStatus;
import io.herald.core.model.NewsletterTemplate;
import io.herald.core.model.Schedule;
import io.herald.core.scheduler.DeliveryRepository;
import io.herald.core.scheduler.ScheduleRepository;
import io.herald.core.scheduler.TemplateRepository;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local store, used for tests and when no database is configured. Nothing survives a restart.
 */
public final class InMemoryNewsletterStore
    implements ScheduleRepository, TemplateRepository, DeliveryRepository, InAppNotificationStore {

    private final Map<String, Schedule> schedules = new LinkedHashMap<>();
    private final Map<String, NewsletterTemplate> templates = new LinkedHashMap<>();
    private final Map<String, Delivery> deliveries = new LinkedHashMap<>();
    private final List<InAppNotification> notifications = new ArrayList<>();

    @Override
    public synchronized List<Schedule> findDue(Instant now) {
        return schedules.values().stream()
            .filter(schedule -> schedule.isDue(now))
            .sorted(Comparator.comparing(Schedule::nextRunAt))
            .toList();
    }

    @Override
    public synchronized Optional<Schedule> findById(String id) {
        return Optional.ofNullable(schedules.get(id));
    }

    @Override
    public synchronized List<Schedule> list() {
        return List.copyOf(schedules.values());
    }

    @Override
    public synchronized void save(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        schedules.put(schedule.id(), schedule);
    }

    @Override
    public synchronized void updateRunStatus(String id, DeliveryStatus status, Instant lastRunAt, Instant nextRunAt)
        throws IOException {
        Schedule current = schedules.get(id);
        if (current == null) {
            throw new IOException("schedule not found: " + id);
        }
        schedules.put(id, current.withRunStatus(status, lastRunAt, nextRunAt));
    }

    @Override
    public synchronized Optional<NewsletterTemplate> findTemplate(String id) {
        return Optional.ofNullable(templates.get(id));
    }

    @Override
    public synchronized void saveTemplate(NewsletterTemplate template) {
        Objects.requireNonNull(template, "template must not be null");
        templates.put(template.id(), template);
    }

    @Override
    public synchronized void createDelivery(Delivery delivery) throws IOException {
        Objects.requireNonNull(delivery, "delivery must not be null");
        if (deliveries.containsKey(delivery.id())) {
            throw new IOException("delivery already exists: " + delivery.id());
        }
        deliveries.put(delivery.id(), delivery);
    }

    @Override
    public synchronized void updateDelivery(Delivery delivery) throws IOException {
        Objects.requireNonNull(delivery, "delivery must not be null");
        if (!deliveries.containsKey(delivery.id())) {
            throw new IOException("delivery not found: " + delivery.id());
        }
        deliveries.put(delivery.id(), delivery);
    }

    @Override
    public synchronized Optional<Delivery> findDelivery(String id) {
        return Optional.ofNullable(deliveries.get(id));
    }

    @Override
    public synchronized List<Delivery> listDeliveries(String scheduleId, int limit) {
        return deliveries.values().stream()
            .filter(delivery -> scheduleId == null || scheduleId.equals(delivery.scheduleId()))
            .sorted(Comparator.comparing(Delivery::startedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .limit(limit > 0 ? limit : Long.MAX_VALUE)
            .toList();
    }

    @Override
    public synchronized void save(InAppNotification notification) {
        Objects.requireNonNull(notification, "notification must not be null");
        notifications.add(notification);
    }

    @Override
    public synchronized List<InAppNotification> listForUser(String userId) {
        return notifications.stream()
            .filter(notification -> notification.userId().equals(userId))
            .toList();
    }
}

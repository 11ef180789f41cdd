package io.herald.app;

import io.herald.core.delivery.channel.InAppNotificationStore;
import io.herald.core.scheduler.DeliveryRepository;
import io.herald.core.scheduler.ScheduleRepository;
import io.herald.core.scheduler.TemplateRepository;

record StoreHandle(
    ScheduleRepository schedules,
    TemplateRepository templates,
    DeliveryRepository deliveries,
    InAppNotificationStore notifications
) {

    static <T extends ScheduleRepository & TemplateRepository & DeliveryRepository & InAppNotificationStore> StoreHandle of(
        T store
    ) {
        return new StoreHandle(store, store, store, store);
    }
}

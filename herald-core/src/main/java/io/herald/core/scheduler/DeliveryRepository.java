package io.herald.core.scheduler;

import io.herald.core.model.Delivery;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface DeliveryRepository {

    void createDelivery(Delivery delivery) throws IOException;

    void updateDelivery(Delivery delivery) throws IOException;

    Optional<Delivery> findDelivery(String id) throws IOException;

    List<Delivery> listDeliveries(String scheduleId, int limit) throws IOException;
}

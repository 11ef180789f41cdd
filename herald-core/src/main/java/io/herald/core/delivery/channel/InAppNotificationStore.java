package io.herald.core.delivery.channel;

import java.io.IOException;
import java.util.List;

public interface InAppNotificationStore {

    void save(InAppNotification notification) throws IOException;

    List<InAppNotification> listForUser(String userId) throws IOException;
}

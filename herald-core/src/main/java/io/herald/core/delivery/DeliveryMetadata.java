package io.herald.core.delivery;

public record DeliveryMetadata(String scheduleName, String serverName, String unsubscribeUrl) {

    public DeliveryMetadata {
        scheduleName = scheduleName == null ? "" : scheduleName;
        serverName = serverName == null ? "" : serverName;
        unsubscribeUrl = unsubscribeUrl == null ? "" : unsubscribeUrl;
    }

    public static DeliveryMetadata empty() {
        return new DeliveryMetadata("", "", "");
    }
}

package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeraldConfig(
    SchedulerSettings scheduler,
    DeliverySettings delivery,
    StorageSettings storage,
    ContentSettings content
) {

    public static HeraldConfig defaults() {
        return new HeraldConfig(
            SchedulerSettings.defaults(),
            DeliverySettings.defaults(),
            StorageSettings.defaults(),
            ContentSettings.defaults()
        );
    }
}

package io.herald.core.delivery;

import io.herald.core.model.ChannelConfig;

/**
 * One notification transport. Implementations report every failure through the returned
 * {@link DeliveryResult}; {@link #send(SendParams)} does not throw.
 */
public interface DeliveryChannel {

    String name();

    boolean supportsHtml();

    /**
     * Maximum body length in characters, {@code 0} when unlimited.
     */
    int maxContentLength();

    void validate(ChannelConfig config);

    DeliveryResult send(SendParams params);
}

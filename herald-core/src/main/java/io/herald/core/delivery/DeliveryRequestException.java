package io.herald.core.delivery;

public class DeliveryRequestException extends Exception {

    public DeliveryRequestException(String message) {
        super(message);
    }
}

package com.pinwatch.governance.service;

/**
 * A redelivery arrived while an earlier attempt for the same id is still being processed.
 * Nothing was recorded for it, so the sender should retry later.
 */
public class DeliveryInProgressException extends RuntimeException {

    public DeliveryInProgressException(String deliveryId) {
        super("Delivery " + deliveryId + " is still being processed, retry later");
    }
}

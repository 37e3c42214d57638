package com.pinwatch.governance.service;

/**
 * Raw inbound webhook: body bytes exactly as received plus the GitHub delivery headers.
 */
public record WebhookDelivery(byte[] body, String signature, String deliveryId, String eventType) {
}

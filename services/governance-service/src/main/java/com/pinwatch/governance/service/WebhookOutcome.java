package com.pinwatch.governance.service;

public record WebhookOutcome(
    ProcessingStatus status,
    String deliveryId,
    String eventType,
    Long runId,
    int workflowsScanned,
    int findingsCount,
    int failedFiles
) {
    public static WebhookOutcome duplicate(String deliveryId, String eventType) {
        return new WebhookOutcome(ProcessingStatus.DUPLICATE, deliveryId, eventType, null, 0, 0, 0);
    }

    public static WebhookOutcome ignored(String deliveryId, String eventType) {
        return new WebhookOutcome(ProcessingStatus.IGNORED, deliveryId, eventType, null, 0, 0, 0);
    }
}

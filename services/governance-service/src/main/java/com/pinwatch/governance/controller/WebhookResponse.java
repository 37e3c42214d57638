package com.pinwatch.governance.controller;

import com.pinwatch.governance.service.WebhookOutcome;
import java.util.Locale;

public record WebhookResponse(
    String status,
    String deliveryId,
    String event,
    Long runId,
    int workflowsScanned,
    int findingsCount,
    int failedFiles
) {
    public static WebhookResponse from(WebhookOutcome outcome) {
        return new WebhookResponse(
            outcome.status().name().toLowerCase(Locale.ROOT),
            outcome.deliveryId(),
            outcome.eventType(),
            outcome.runId(),
            outcome.workflowsScanned(),
            outcome.findingsCount(),
            outcome.failedFiles()
        );
    }
}

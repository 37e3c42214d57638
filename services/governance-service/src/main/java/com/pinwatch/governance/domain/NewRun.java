package com.pinwatch.governance.domain;

public record NewRun(
    String deliveryId,
    String eventType,
    String repository,
    String branch,
    String headSha,
    int workflowsScanned
) {
}

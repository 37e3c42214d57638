package com.pinwatch.governance.controller;

import com.pinwatch.governance.domain.RunEntity;
import java.time.Instant;

public record RunResponse(
    Long id,
    String deliveryId,
    Instant createdAt,
    String eventType,
    String repository,
    String branch,
    String headSha,
    int workflowsScanned,
    int findingsCount,
    int failedFiles
) {
    public static RunResponse from(RunEntity entity) {
        return new RunResponse(
            entity.getId(),
            entity.getDeliveryId(),
            entity.getCreatedAt(),
            entity.getEventType(),
            entity.getRepository(),
            entity.getBranch(),
            entity.getHeadSha(),
            entity.getWorkflowsScanned(),
            entity.getFindingsCount(),
            entity.getFailedFiles()
        );
    }
}

package com.pinwatch.governance.controller;

import com.pinwatch.governance.domain.FindingEntity;

public record FindingResponse(
    Long id,
    Long runId,
    String workflow,
    String action,
    String ref,
    boolean pinned,
    boolean internal,
    Integer line,
    String raw
) {
    public static FindingResponse from(FindingEntity entity) {
        return new FindingResponse(
            entity.getId(),
            entity.getRunId(),
            entity.getWorkflowPath(),
            entity.getActionId(),
            entity.getRef(),
            entity.isPinned(),
            entity.isInternal(),
            entity.getLineNumber(),
            entity.getRawFragment()
        );
    }
}

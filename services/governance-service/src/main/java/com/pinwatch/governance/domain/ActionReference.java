package com.pinwatch.governance.domain;

public record ActionReference(
    String workflowPath,
    String actionId,
    String ref,
    boolean pinned,
    boolean internal,
    Integer lineNumber,
    String rawFragment
) {
}

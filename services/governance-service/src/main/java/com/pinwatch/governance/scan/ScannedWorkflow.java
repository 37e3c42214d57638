package com.pinwatch.governance.scan;

public record ScannedWorkflow(String path, String content) {
}

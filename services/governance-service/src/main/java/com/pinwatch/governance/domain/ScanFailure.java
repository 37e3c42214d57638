package com.pinwatch.governance.domain;

public record ScanFailure(String path, ScanFailureCode code, String reason) {

    public static ScanFailure of(String path, ScanFailureCode code, String reason) {
        String boundedPath = path == null ? null : truncate(path, ScanFailureEntity.WORKFLOW_PATH_LENGTH);
        String boundedReason = reason == null || reason.isBlank() ? "unknown" : truncate(reason, ScanFailureEntity.REASON_LENGTH);
        return new ScanFailure(boundedPath, code, boundedReason);
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}

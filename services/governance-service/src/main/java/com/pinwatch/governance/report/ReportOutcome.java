package com.pinwatch.governance.report;

public enum ReportOutcome {
    PUBLISHED,
    SKIPPED,
    FAILED
}

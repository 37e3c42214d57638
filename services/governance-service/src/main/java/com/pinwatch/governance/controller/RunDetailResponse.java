package com.pinwatch.governance.controller;

import java.time.Instant;
import java.util.List;

public record RunDetailResponse(RunResponse run, List<FailureItem> failures) {

    public record FailureItem(String workflow, String code, String reason, Instant createdAt) {
    }
}

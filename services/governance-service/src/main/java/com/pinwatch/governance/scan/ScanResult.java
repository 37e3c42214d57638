package com.pinwatch.governance.scan;

import com.pinwatch.governance.domain.ScanFailure;
import java.util.List;

public record ScanResult(List<ScannedWorkflow> workflows, List<ScanFailure> failures) {

    public ScanResult {
        workflows = List.copyOf(workflows);
        failures = List.copyOf(failures);
    }

    public static ScanResult empty() {
        return new ScanResult(List.of(), List.of());
    }
}

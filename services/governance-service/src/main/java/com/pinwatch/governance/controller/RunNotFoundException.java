package com.pinwatch.governance.controller;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(Long runId) {
        super("Run not found: " + runId);
    }
}

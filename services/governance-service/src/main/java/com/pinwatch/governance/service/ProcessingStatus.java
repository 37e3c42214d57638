package com.pinwatch.governance.service;

public enum ProcessingStatus {
    ACCEPTED,
    DUPLICATE,
    IGNORED
}

package com.pinwatch.governance.replay;

public enum ReplayBackend {
    LOCAL,
    SHARED
}

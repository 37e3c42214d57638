package com.pinwatch.governance.replay;

/**
 * What the shared replay guard does when its backing store cannot be reached.
 */
public enum ReplayFailurePolicy {
    /** Admit the delivery and accept the risk of processing it twice. */
    FAIL_OPEN,
    /** Refuse the delivery with {@link ReplayStoreUnavailableException}. */
    FAIL_CLOSED
}

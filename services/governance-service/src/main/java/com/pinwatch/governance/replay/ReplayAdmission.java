package com.pinwatch.governance.replay;

public enum ReplayAdmission {
    /** First delivery of the id; the caller owns it until commit or release. */
    ADMITTED,
    /** Another attempt holds the id and has not committed yet. */
    IN_FLIGHT,
    /** The id was committed within the window. */
    DUPLICATE
}

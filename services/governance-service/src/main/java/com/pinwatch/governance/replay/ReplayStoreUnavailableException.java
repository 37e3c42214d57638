package com.pinwatch.governance.replay;

public class ReplayStoreUnavailableException extends RuntimeException {

    public ReplayStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.pinwatch.governance.client;

public class ContentFetchException extends RuntimeException {

    public ContentFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.pinwatch.governance.extract;

public class WorkflowParseException extends RuntimeException {

    public WorkflowParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public WorkflowParseException(String message) {
        super(message);
    }
}

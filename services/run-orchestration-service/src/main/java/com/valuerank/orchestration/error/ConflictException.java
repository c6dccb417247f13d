package com.valuerank.orchestration.error;

public class ConflictException extends OrchestrationException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

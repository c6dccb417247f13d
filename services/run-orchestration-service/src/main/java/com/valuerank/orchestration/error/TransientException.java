package com.valuerank.orchestration.error;

public class TransientException extends OrchestrationException {

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}

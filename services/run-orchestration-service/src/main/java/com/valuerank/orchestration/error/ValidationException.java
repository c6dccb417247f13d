package com.valuerank.orchestration.error;

public class ValidationException extends OrchestrationException {

    public ValidationException(String message) {
        super(message);
    }
}

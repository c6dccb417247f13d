package com.valuerank.orchestration.error;

public class AuthenticationRequiredException extends OrchestrationException {

    public AuthenticationRequiredException() {
        super("Authentication required");
    }
}

package com.valuerank.orchestration.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Priority {
    LOW(1),
    NORMAL(5),
    HIGH(10);

    private final int queueValue;

    Priority(int queueValue) {
        this.queueValue = queueValue;
    }

    public int queueValue() {
        return queueValue;
    }

    public static Optional<Priority> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.name().equals(normalized)).findFirst();
    }
}

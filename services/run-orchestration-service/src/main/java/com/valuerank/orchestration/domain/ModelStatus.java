package com.valuerank.orchestration.domain;

public enum ModelStatus {
    ACTIVE,
    DEPRECATED
}

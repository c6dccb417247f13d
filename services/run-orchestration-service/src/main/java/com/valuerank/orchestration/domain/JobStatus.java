package com.valuerank.orchestration.domain;

public enum JobStatus {
    QUEUED,
    SUCCESS,
    FAILED
}

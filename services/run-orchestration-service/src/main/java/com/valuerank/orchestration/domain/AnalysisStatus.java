package com.valuerank.orchestration.domain;

public enum AnalysisStatus {
    CURRENT,
    SUPERSEDED
}

package com.valuerank.orchestration.domain;

public enum AnalysisType {
    BASIC,
    AGGREGATE
}

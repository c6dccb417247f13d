package com.valuerank.orchestration.controller;

public record AggregateRequest(
    String preambleVersionId,
    Integer definitionVersion
) {
}

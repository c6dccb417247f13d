package com.valuerank.orchestration.controller;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

public record DomainTrialRequest(
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    Double temperature,

    Double maxBudgetUsd
) {
}

package com.valuerank.orchestration.controller;

public record LaunchRunResponse(RunResponse run, int jobCount, Double estimatedCostUsd) {
}

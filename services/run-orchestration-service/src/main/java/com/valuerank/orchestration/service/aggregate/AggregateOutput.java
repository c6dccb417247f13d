package com.valuerank.orchestration.service.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ConfidenceInterval;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ContestedScenario;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ValueCounts;
import java.util.List;
import java.util.Map;

public record AggregateOutput(
    Map<String, ModelAggregate> perModel,
    JsonNode modelAgreement,
    Visualization visualizationData,
    List<ContestedScenario> mostContestedScenarios,
    Map<String, DecisionStats> decisionStats,
    Map<String, ValueAggregateStats> valueAggregateStats,
    int runCount,
    List<String> sourceRunIds
) {

    public record ModelAggregate(int sampleSize, Map<String, ValueAggregate> values, Overall overall) {
    }

    public record ValueAggregate(ValueCounts count, double winRate, ConfidenceInterval confidenceInterval) {
    }

    public record Overall(double mean, double stdDev, double min, double max) {

        static final Overall EMPTY = new Overall(0, 0, 0, 0);
    }

    public record Visualization(
        Map<String, Map<String, Integer>> decisionDistribution,
        Map<String, Map<String, Double>> modelScenarioMatrix
    ) {
    }

    public record DecisionStats(Map<Integer, OptionStats> options) {
    }

    public record OptionStats(double mean, double sd, double sem, int n) {
    }

    public record ValueAggregateStats(Map<String, WinRateStats> values) {
    }

    public record WinRateStats(double winRateMean, double winRateSd, double winRateSem) {
    }
}

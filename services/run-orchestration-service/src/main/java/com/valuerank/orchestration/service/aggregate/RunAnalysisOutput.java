package com.valuerank.orchestration.service.aggregate;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RunAnalysisOutput(
    Map<String, ModelStats> perModel,
    VisualizationData visualizationData,
    List<ContestedScenario> mostContestedScenarios,
    JsonNode modelAgreement
) {
    public RunAnalysisOutput {
        perModel = perModel == null ? Map.of() : perModel;
        visualizationData = visualizationData == null ? new VisualizationData(null, null) : visualizationData;
        mostContestedScenarios = mostContestedScenarios == null ? List.of() : mostContestedScenarios;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelStats(Integer sampleSize, Map<String, ValueStats> values) {

        public ModelStats {
            values = values == null ? Map.of() : values;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValueStats(ValueCounts count, double winRate, ConfidenceInterval confidenceInterval) {

        public ValueStats {
            count = count == null ? new ValueCounts(0, 0, 0) : count;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValueCounts(int prioritized, int deprioritized, int neutral) {

        ValueCounts plus(ValueCounts other) {
            return new ValueCounts(
                prioritized + other.prioritized,
                deprioritized + other.deprioritized,
                neutral + other.neutral);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConfidenceInterval(double lower, double upper, double level, String method) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VisualizationData(
        Map<String, Map<String, Double>> decisionDistribution,
        Map<String, Map<String, Double>> modelScenarioMatrix
    ) {
        public VisualizationData {
            decisionDistribution = decisionDistribution == null ? Map.of() : decisionDistribution;
        }
    }

    public static class ContestedScenario {

        private String scenarioId;
        private double variance;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public ContestedScenario() {
        }

        public ContestedScenario(String scenarioId, double variance) {
            this.scenarioId = scenarioId;
            this.variance = variance;
        }

        public String getScenarioId() {
            return scenarioId;
        }

        public void setScenarioId(String scenarioId) {
            this.scenarioId = scenarioId;
        }

        public double getVariance() {
            return variance;
        }

        public void setVariance(double variance) {
            this.variance = variance;
        }

        @JsonAnyGetter
        public Map<String, Object> getAttributes() {
            return attributes;
        }

        @JsonAnySetter
        public void setAttribute(String name, Object value) {
            attributes.put(name, value);
        }

        ContestedScenario withVariance(double averaged) {
            ContestedScenario copy = new ContestedScenario(scenarioId, averaged);
            copy.attributes.putAll(attributes);
            return copy;
        }
    }
}

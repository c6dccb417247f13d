package com.valuerank.orchestration.service.aggregate;

import com.valuerank.orchestration.config.OrchestratorProperties;
import com.valuerank.orchestration.domain.TranscriptEntity;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.DecisionStats;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.ModelAggregate;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.OptionStats;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.Overall;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.ValueAggregate;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.ValueAggregateStats;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.Visualization;
import com.valuerank.orchestration.service.aggregate.AggregateOutput.WinRateStats;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ConfidenceInterval;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ContestedScenario;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ModelStats;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ValueCounts;
import com.valuerank.orchestration.service.aggregate.RunAnalysisOutput.ValueStats;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

@Component
public class AggregateStatisticsMerger {

    static final double Z_95 = 1.96;
    static final double CONFIDENCE_LEVEL = 0.95;
    static final String CI_METHOD = "aggregate-sem";

    private final int minDecisionCode;
    private final int maxDecisionCode;
    private final int contestedScenarioLimit;

    public AggregateStatisticsMerger(OrchestratorProperties properties) {
        this.minDecisionCode = properties.getMinDecisionCode();
        this.maxDecisionCode = properties.getMaxDecisionCode();
        this.contestedScenarioLimit = properties.getContestedScenarioLimit();
    }

    public AggregateOutput merge(
        List<RunAnalysisOutput> analyses,
        List<TranscriptEntity> transcripts,
        List<String> sourceRunIds
    ) {
        if (analyses.isEmpty()) {
            throw new IllegalArgumentException("At least one analysis is required");
        }
        Set<String> modelIds = new TreeSet<>();
        analyses.forEach(a -> modelIds.addAll(a.perModel().keySet()));

        Map<String, ModelAggregate> perModel = new TreeMap<>();
        Map<String, DecisionStats> decisionStats = new TreeMap<>();
        Map<String, ValueAggregateStats> valueAggregateStats = new TreeMap<>();
        for (String modelId : modelIds) {
            List<RunAnalysisOutput> withModel = analyses.stream()
                .filter(a -> a.perModel().containsKey(modelId))
                .toList();
            decisionStats.put(modelId, decisionStats(modelId, withModel));

            Map<String, ValueAggregate> values = new TreeMap<>();
            Map<String, WinRateStats> rateStats = new TreeMap<>();
            mergeWinRates(modelId, withModel, values, rateStats);
            valueAggregateStats.put(modelId, new ValueAggregateStats(rateStats));

            int sampleSize = withModel.stream()
                .map(a -> a.perModel().get(modelId).sampleSize())
                .mapToInt(size -> size == null ? 0 : size)
                .sum();
            perModel.put(modelId, new ModelAggregate(sampleSize, values, Overall.EMPTY));
        }

        return new AggregateOutput(
            perModel,
            analyses.get(0).modelAgreement(),
            new Visualization(decisionDistribution(modelIds, transcripts), Map.of()),
            mergeContested(analyses),
            decisionStats,
            valueAggregateStats,
            analyses.size(),
            List.copyOf(sourceRunIds));
    }

    /**
     * Mean-of-scenario-means: each scenario casts one vote, its mean decision rounded and clamped.
     */
    Map<String, Map<String, Integer>> decisionDistribution(Set<String> modelIds, List<TranscriptEntity> transcripts) {
        Map<String, Map<String, List<Integer>>> byModelAndScenario = new LinkedHashMap<>();
        for (TranscriptEntity transcript : transcripts) {
            Integer code = parseCode(transcript.getDecisionCode());
            if (code == null || transcript.getScenarioId() == null || transcript.getModelId() == null) {
                continue;
            }
            byModelAndScenario
                .computeIfAbsent(transcript.getModelId(), k -> new LinkedHashMap<>())
                .computeIfAbsent(transcript.getScenarioId(), k -> new ArrayList<>())
                .add(code);
        }

        Map<String, Map<String, Integer>> distribution = new TreeMap<>();
        for (String modelId : modelIds) {
            Map<String, Integer> votes = new LinkedHashMap<>();
            for (int code = minDecisionCode; code <= maxDecisionCode; code++) {
                votes.put(String.valueOf(code), 0);
            }
            for (List<Integer> decisions : byModelAndScenario.getOrDefault(modelId, Map.of()).values()) {
                double mean = decisions.stream().mapToInt(Integer::intValue).average().orElse(Double.NaN);
                if (Double.isNaN(mean)) {
                    continue;
                }
                long clamped = Math.max(minDecisionCode, Math.min(maxDecisionCode, Math.round(mean)));
                votes.merge(String.valueOf(clamped), 1, Integer::sum);
            }
            distribution.put(modelId, votes);
        }
        return distribution;
    }

    private DecisionStats decisionStats(String modelId, List<RunAnalysisOutput> analyses) {
        Map<Integer, List<Double>> sharesByOption = new TreeMap<>();
        for (RunAnalysisOutput analysis : analyses) {
            Map<String, Double> distribution = analysis.visualizationData().decisionDistribution().get(modelId);
            if (distribution == null) {
                continue;
            }
            double runTotal = distribution.values().stream()
                .mapToDouble(v -> v == null ? 0.0 : v)
                .sum();
            if (runTotal <= 0) {
                continue;
            }
            for (int option = minDecisionCode; option <= maxDecisionCode; option++) {
                Double count = distribution.get(String.valueOf(option));
                sharesByOption.computeIfAbsent(option, k -> new ArrayList<>())
                    .add((count == null ? 0.0 : count) / runTotal);
            }
        }

        Map<Integer, OptionStats> options = new TreeMap<>();
        sharesByOption.forEach((option, shares) -> {
            Moments moments = Moments.of(shares);
            options.put(option, new OptionStats(moments.mean(), moments.sd(), moments.sem(), moments.n()));
        });
        return new DecisionStats(options);
    }

    private void mergeWinRates(
        String modelId,
        List<RunAnalysisOutput> analyses,
        Map<String, ValueAggregate> values,
        Map<String, WinRateStats> rateStats
    ) {
        Map<String, ValueCounts> counts = new TreeMap<>();
        Map<String, List<Double>> runRates = new TreeMap<>();
        for (RunAnalysisOutput analysis : analyses) {
            ModelStats stats = analysis.perModel().get(modelId);
            for (Map.Entry<String, ValueStats> entry : stats.values().entrySet()) {
                counts.merge(entry.getKey(), entry.getValue().count(), ValueCounts::plus);
                runRates.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(entry.getValue().winRate());
            }
        }

        counts.forEach((valueId, total) -> {
            int battles = total.prioritized() + total.deprioritized();
            double winRate = battles > 0 ? (double) total.prioritized() / battles : 0.0;
            Moments moments = Moments.of(runRates.get(valueId));
            rateStats.put(valueId, new WinRateStats(moments.mean(), moments.sd(), moments.sem()));
            values.put(valueId, new ValueAggregate(total, winRate, confidenceInterval(moments)));
        });
    }

    static ConfidenceInterval confidenceInterval(Moments moments) {
        double lower = Math.max(0.0, moments.mean() - Z_95 * moments.sem());
        double upper = Math.min(1.0, moments.mean() + Z_95 * moments.sem());
        return new ConfidenceInterval(lower, upper, CONFIDENCE_LEVEL, CI_METHOD);
    }

    private List<ContestedScenario> mergeContested(List<RunAnalysisOutput> analyses) {
        Map<String, ContestedScenario> first = new LinkedHashMap<>();
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (RunAnalysisOutput analysis : analyses) {
            for (ContestedScenario scenario : analysis.mostContestedScenarios()) {
                if (scenario == null || scenario.getScenarioId() == null) {
                    continue;
                }
                first.putIfAbsent(scenario.getScenarioId(), scenario);
                double[] sum = sums.computeIfAbsent(scenario.getScenarioId(), k -> new double[2]);
                sum[0] += scenario.getVariance();
                sum[1] += 1;
            }
        }
        return first.entrySet().stream()
            .map(e -> e.getValue().withVariance(sums.get(e.getKey())[0] / sums.get(e.getKey())[1]))
            .sorted(Comparator.comparingDouble(ContestedScenario::getVariance).reversed())
            .limit(contestedScenarioLimit)
            .toList();
    }

    private static Integer parseCode(String decisionCode) {
        if (decisionCode == null) {
            return null;
        }
        try {
            return Integer.parseInt(decisionCode.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    record Moments(double mean, double sd, double sem, int n) {

        static Moments of(List<Double> samples) {
            int n = samples.size();
            if (n == 0) {
                return new Moments(0.0, 0.0, 0.0, 0);
            }
            double mean = samples.stream().mapToDouble(Double::doubleValue).sum() / n;
            double variance = samples.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / n;
            double sd = Math.sqrt(variance);
            return new Moments(mean, sd, sd / Math.sqrt(n), n);
        }
    }
}

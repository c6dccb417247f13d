package com.valuerank.orchestration.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private String costEstimatorBaseUrl = "http://localhost:8010";
    private String stabilityPlannerBaseUrl = "http://localhost:8011";
    private String defaultQueueName = "probe_scenario";
    private Duration providerCacheTtl = Duration.ofMinutes(1);
    private int domainTrialSamplePercentage = 100;
    private int domainTrialBatchSize = 25;
    private int jobsMaxAttempts = 3;
    private int executorPoolSize = 8;
    private String aggregateLockMode = "postgres";
    private Duration aggregateLockTimeout = Duration.ofSeconds(10);
    private boolean aggregateAutoTrigger = true;
    private int minDecisionCode = 1;
    private int maxDecisionCode = 5;
    private int contestedScenarioLimit = 20;
    private int finalTrialHistoryLimit = 50;

    public String getCostEstimatorBaseUrl() {
        return costEstimatorBaseUrl;
    }

    public void setCostEstimatorBaseUrl(String costEstimatorBaseUrl) {
        this.costEstimatorBaseUrl = costEstimatorBaseUrl;
    }

    public String getStabilityPlannerBaseUrl() {
        return stabilityPlannerBaseUrl;
    }

    public void setStabilityPlannerBaseUrl(String stabilityPlannerBaseUrl) {
        this.stabilityPlannerBaseUrl = stabilityPlannerBaseUrl;
    }

    public String getDefaultQueueName() {
        return defaultQueueName;
    }

    public void setDefaultQueueName(String defaultQueueName) {
        this.defaultQueueName = defaultQueueName;
    }

    public Duration getProviderCacheTtl() {
        return providerCacheTtl;
    }

    public void setProviderCacheTtl(Duration providerCacheTtl) {
        this.providerCacheTtl = providerCacheTtl;
    }

    public int getDomainTrialSamplePercentage() {
        return domainTrialSamplePercentage;
    }

    public void setDomainTrialSamplePercentage(int domainTrialSamplePercentage) {
        this.domainTrialSamplePercentage = domainTrialSamplePercentage;
    }

    public int getDomainTrialBatchSize() {
        return domainTrialBatchSize;
    }

    public void setDomainTrialBatchSize(int domainTrialBatchSize) {
        this.domainTrialBatchSize = domainTrialBatchSize;
    }

    public int getJobsMaxAttempts() {
        return jobsMaxAttempts;
    }

    public void setJobsMaxAttempts(int jobsMaxAttempts) {
        this.jobsMaxAttempts = jobsMaxAttempts;
    }

    public int getExecutorPoolSize() {
        return executorPoolSize;
    }

    public void setExecutorPoolSize(int executorPoolSize) {
        this.executorPoolSize = executorPoolSize;
    }

    public String getAggregateLockMode() {
        return aggregateLockMode;
    }

    public void setAggregateLockMode(String aggregateLockMode) {
        this.aggregateLockMode = aggregateLockMode;
    }

    public Duration getAggregateLockTimeout() {
        return aggregateLockTimeout;
    }

    public void setAggregateLockTimeout(Duration aggregateLockTimeout) {
        this.aggregateLockTimeout = aggregateLockTimeout;
    }

    public boolean isAggregateAutoTrigger() {
        return aggregateAutoTrigger;
    }

    public void setAggregateAutoTrigger(boolean aggregateAutoTrigger) {
        this.aggregateAutoTrigger = aggregateAutoTrigger;
    }

    public int getMinDecisionCode() {
        return minDecisionCode;
    }

    public void setMinDecisionCode(int minDecisionCode) {
        this.minDecisionCode = minDecisionCode;
    }

    public int getMaxDecisionCode() {
        return maxDecisionCode;
    }

    public void setMaxDecisionCode(int maxDecisionCode) {
        this.maxDecisionCode = maxDecisionCode;
    }

    public int getContestedScenarioLimit() {
        return contestedScenarioLimit;
    }

    public void setContestedScenarioLimit(int contestedScenarioLimit) {
        this.contestedScenarioLimit = contestedScenarioLimit;
    }

    public int getFinalTrialHistoryLimit() {
        return finalTrialHistoryLimit;
    }

    public void setFinalTrialHistoryLimit(int finalTrialHistoryLimit) {
        this.finalTrialHistoryLimit = finalTrialHistoryLimit;
    }
}

package com.tripsync.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tripsync")
public class TripSyncProperties {

    private ExecutorConfig executor = new ExecutorConfig();
    private StateConfig state = new StateConfig();
    private OrchestratorLoopConfig orchestrator = new OrchestratorLoopConfig();
    private StoreConfig store = new StoreConfig();
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public enum StoreType {
        JPA, MEMORY
    }

    public static class ExecutorConfig {
        private int concurrency = 4;
        private Duration taskTimeout = Duration.ofSeconds(30);
        private Duration batchTimeout = Duration.ofSeconds(120);
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(500);

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
        public Duration getBatchTimeout() { return batchTimeout; }
        public void setBatchTimeout(Duration batchTimeout) { this.batchTimeout = batchTimeout; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = Math.max(1, maxAttempts); }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    }

    public static class StateConfig {
        private String template = "classpath:state/default-state.json";
        private Duration lockTimeout = Duration.ofSeconds(5);
        private int commitRetries = 3;

        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }
        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
        public int getCommitRetries() { return commitRetries; }
        public void setCommitRetries(int commitRetries) { this.commitRetries = Math.max(0, commitRetries); }
    }

    public static class OrchestratorLoopConfig {
        private int maxIterations = 3;
        private int historyWindow = 5;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = Math.max(1, maxIterations); }
        public int getHistoryWindow() { return historyWindow; }
        public void setHistoryWindow(int historyWindow) { this.historyWindow = historyWindow; }
    }

    public static class StoreConfig {
        private StoreType type = StoreType.JPA;

        public StoreType getType() { return type; }
        public void setType(StoreType type) { this.type = type != null ? type : StoreType.JPA; }
    }

    public static class OpenAIConfig {
        private String model;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public ExecutorConfig getExecutor() {
        return executor;
    }

    public void setExecutor(ExecutorConfig executor) {
        this.executor = executor != null ? executor : new ExecutorConfig();
    }

    public StateConfig getState() {
        return state;
    }

    public void setState(StateConfig state) {
        this.state = state != null ? state : new StateConfig();
    }

    public OrchestratorLoopConfig getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(OrchestratorLoopConfig orchestrator) {
        this.orchestrator = orchestrator != null ? orchestrator : new OrchestratorLoopConfig();
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store != null ? store : new StoreConfig();
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }
}

package ai.genflow.workflow.engine.config;

import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.graph.model.NodeOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Execution policy: collaborator timeouts, retry backoff and scheduling.
 */
@ConfigurationProperties(prefix = "genflow.engine")
public class EngineProperties {

    private Duration retrievalTimeout = Duration.ofSeconds(10);
    private Duration webSearchTimeout = Duration.ofSeconds(10);
    private Duration generationTimeout = Duration.ofSeconds(30);
    private int maxRetries = 2;
    private Duration retryInitialBackoff = Duration.ofMillis(200);
    private double retryBackoffMultiplier = 2.0;
    private Duration retryMaxBackoff = Duration.ofSeconds(2);
    private boolean parallelBranches = false;
    private String defaultModel = NodeOptions.DEFAULT_MODEL;
    private int collaboratorThreads = 8;
    private Duration historyTimeout = Duration.ofSeconds(10);
    private int historyThreads = 2;
    private int historyQueueCapacity = 100;

    public Duration timeoutFor(CollaboratorKind kind) {
        return switch (kind) {
            case RETRIEVAL -> retrievalTimeout;
            case WEB_SEARCH -> webSearchTimeout;
            case GENERATION -> generationTimeout;
        };
    }

    public Duration getRetrievalTimeout() {
        return retrievalTimeout;
    }

    public void setRetrievalTimeout(Duration retrievalTimeout) {
        this.retrievalTimeout = retrievalTimeout;
    }

    public Duration getWebSearchTimeout() {
        return webSearchTimeout;
    }

    public void setWebSearchTimeout(Duration webSearchTimeout) {
        this.webSearchTimeout = webSearchTimeout;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryInitialBackoff() {
        return retryInitialBackoff;
    }

    public void setRetryInitialBackoff(Duration retryInitialBackoff) {
        this.retryInitialBackoff = retryInitialBackoff;
    }

    public double getRetryBackoffMultiplier() {
        return retryBackoffMultiplier;
    }

    public void setRetryBackoffMultiplier(double retryBackoffMultiplier) {
        this.retryBackoffMultiplier = retryBackoffMultiplier;
    }

    public Duration getRetryMaxBackoff() {
        return retryMaxBackoff;
    }

    public void setRetryMaxBackoff(Duration retryMaxBackoff) {
        this.retryMaxBackoff = retryMaxBackoff;
    }

    public boolean isParallelBranches() {
        return parallelBranches;
    }

    public void setParallelBranches(boolean parallelBranches) {
        this.parallelBranches = parallelBranches;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public int getCollaboratorThreads() {
        return collaboratorThreads;
    }

    public void setCollaboratorThreads(int collaboratorThreads) {
        this.collaboratorThreads = collaboratorThreads;
    }

    public Duration getHistoryTimeout() {
        return historyTimeout;
    }

    public void setHistoryTimeout(Duration historyTimeout) {
        this.historyTimeout = historyTimeout;
    }

    public int getHistoryThreads() {
        return historyThreads;
    }

    public void setHistoryThreads(int historyThreads) {
        this.historyThreads = historyThreads;
    }

    public int getHistoryQueueCapacity() {
        return historyQueueCapacity;
    }

    public void setHistoryQueueCapacity(int historyQueueCapacity) {
        this.historyQueueCapacity = historyQueueCapacity;
    }
}

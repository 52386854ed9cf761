package ai.genflow.workflow.engine.config;

import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.engine.collaborator.GenerationClient;
import ai.genflow.workflow.engine.collaborator.HistoryStore;
import ai.genflow.workflow.engine.collaborator.RetrievalClient;
import ai.genflow.workflow.engine.collaborator.WebSearchClient;
import ai.genflow.workflow.engine.collaborator.http.HttpHistoryStore;
import ai.genflow.workflow.engine.collaborator.http.HttpRetrievalClient;
import ai.genflow.workflow.engine.collaborator.http.HttpWebSearchClient;
import ai.genflow.workflow.engine.collaborator.http.LoggingHistoryStore;
import ai.genflow.workflow.engine.collaborator.http.OpenAiGenerationClient;
import ai.genflow.workflow.graph.validation.WorkflowGraphValidator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class EngineConfiguration {

    @Bean
    public WorkflowGraphValidator workflowGraphValidator(EngineProperties properties) {
        return new WorkflowGraphValidator(properties.getDefaultModel());
    }

    @Bean(name = "collaboratorExecutor", destroyMethod = "shutdown")
    public ExecutorService collaboratorExecutor(EngineProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getCollaboratorThreads()),
                new CustomizableThreadFactory("collaborator-"));
    }

    @Bean(name = "branchExecutor", destroyMethod = "shutdown")
    public ExecutorService branchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("workflow-branch-"));
    }

    /**
     * History appends are fire-and-forget; once the queue is full further appends are rejected
     * rather than queued without bound.
     */
    @Bean(name = "historyExecutor", destroyMethod = "shutdown")
    public ExecutorService historyExecutor(EngineProperties properties) {
        int threads = Math.max(1, properties.getHistoryThreads());
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, properties.getHistoryQueueCapacity())),
                new CustomizableThreadFactory("history-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetrievalClient retrievalClient(CollaboratorProperties properties, EngineProperties engineProperties,
                                           RestClient.Builder restClientBuilder) {
        return new HttpRetrievalClient(properties,
                withTimeouts(restClientBuilder, engineProperties.timeoutFor(CollaboratorKind.RETRIEVAL)));
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerationClient generationClient(CollaboratorProperties properties, EngineProperties engineProperties,
                                             RestClient.Builder restClientBuilder) {
        return new OpenAiGenerationClient(properties,
                withTimeouts(restClientBuilder, engineProperties.timeoutFor(CollaboratorKind.GENERATION)));
    }

    @Bean
    @ConditionalOnMissingBean
    public WebSearchClient webSearchClient(CollaboratorProperties properties, EngineProperties engineProperties,
                                           RestClient.Builder restClientBuilder) {
        return new HttpWebSearchClient(properties,
                withTimeouts(restClientBuilder, engineProperties.timeoutFor(CollaboratorKind.WEB_SEARCH)));
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryStore historyStore(CollaboratorProperties properties, EngineProperties engineProperties,
                                     RestClient.Builder restClientBuilder) {
        String baseUrl = properties.getHistory().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return new LoggingHistoryStore();
        }
        return new HttpHistoryStore(properties, withTimeouts(restClientBuilder, engineProperties.getHistoryTimeout()));
    }

    /**
     * Copy of {@code builder} whose requests give up connecting or reading after {@code timeout}.
     */
    public static RestClient.Builder withTimeouts(RestClient.Builder builder, Duration timeout) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(timeout)
                .withReadTimeout(timeout);
        return builder.clone().requestFactory(ClientHttpRequestFactories.get(settings));
    }
}

package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.engine.EngineTestSupport;
import ai.genflow.workflow.engine.collaborator.CollaboratorException;
import ai.genflow.workflow.engine.collaborator.CollaboratorInvoker;
import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.engine.collaborator.GenerationRequest;
import ai.genflow.workflow.engine.collaborator.GenerationResult;
import ai.genflow.workflow.engine.collaborator.WebSearchClient;
import ai.genflow.workflow.engine.collaborator.WebSearchHit;
import ai.genflow.workflow.engine.config.EngineProperties;
import ai.genflow.workflow.graph.exception.ConfigException;
import ai.genflow.workflow.graph.exception.ErrorKind;
import ai.genflow.workflow.graph.model.NodeConfig;
import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmEngineNodeExecutorTest {

    private final AtomicReference<GenerationRequest> lastRequest = new AtomicReference<>();
    private final AtomicInteger searches = new AtomicInteger();

    private ExecutorService collaboratorExecutor;
    private EngineProperties properties;
    private WebSearchClient webSearchClient;

    @BeforeEach
    void setUp() {
        collaboratorExecutor = Executors.newCachedThreadPool();
        properties = EngineTestSupport.fastProperties();
        webSearchClient = (query, maxResults) -> {
            searches.incrementAndGet();
            return List.of(
                    new WebSearchHit("Paris", "Capital of France", "https://example.org/paris"),
                    new WebSearchHit("France", "Country in Europe", "https://example.org/france"));
        };
    }

    @AfterEach
    void tearDown() {
        collaboratorExecutor.shutdownNow();
    }

    @Test
    void testPlainQueryIsSentUnchanged() {
        Map<String, Object> outputs = execute(Map.of(), Map.of(Ports.QUERY, "What is 2+2?"));

        assertThat(outputs).containsEntry(Ports.RESPONSE, "4").containsEntry(Ports.SOURCES, List.of());
        GenerationRequest request = lastRequest.get();
        assertThat(request.userMessage()).isEqualTo("What is 2+2?");
        assertThat(request.systemPrompt()).isEqualTo(PromptBuilder.DEFAULT_PROMPT);
        assertThat(request.model()).isEqualTo("gpt-4o-mini");
        assertThat(request.temperature()).isEqualTo(0.7);
        assertThat(request.maxTokens()).isEqualTo(1000);
        assertThat(searches).hasValue(0);
    }

    @Test
    void testKnowledgeContextGroundsPrompt() {
        execute(Map.of("systemPrompt", "Answer tersely."),
                Map.of(Ports.QUERY, "Capital?", Ports.CONTEXT, "Paris is the capital of France"));

        GenerationRequest request = lastRequest.get();
        assertThat(request.systemPrompt())
                .startsWith("Answer tersely.")
                .contains("--- KNOWLEDGE BASE CONTEXT ---\nParis is the capital of France")
                .contains("CRITICAL INSTRUCTIONS:");
        assertThat(request.userMessage())
                .startsWith("Context from uploaded documents:\nParis is the capital of France")
                .contains("Question: Capital?");
    }

    @Test
    void testWebResultsBecomeContextAndSources() {
        Map<String, Object> outputs = execute(Map.of("enableWebSearch", true, "webSearchResults", 1),
                Map.of(Ports.QUERY, "Capital?"));

        assertThat(outputs.get(Ports.SOURCES)).isEqualTo(List.of("https://example.org/paris"));
        assertThat(lastRequest.get().systemPrompt())
                .contains("--- WEB SEARCH CONTEXT ---")
                .contains("URL: https://example.org/paris")
                .doesNotContain("https://example.org/france");
        assertThat(lastRequest.get().userMessage()).isEqualTo("Capital?");
    }

    @Test
    void testWebSearchFailureIsSoftUnlessStrict() {
        webSearchClient = (query, maxResults) -> {
            throw new CollaboratorException(CollaboratorKind.WEB_SEARCH, "HTTP 401", false);
        };

        Map<String, Object> outputs = execute(Map.of("enableWebSearch", true), Map.of(Ports.QUERY, "Capital?"));
        assertThat(outputs).containsEntry(Ports.SOURCES, List.of());

        assertThatThrownBy(() -> execute(Map.of("enableWebSearch", true, "strict", true),
                Map.of(Ports.QUERY, "Capital?")))
                .isInstanceOf(CollaboratorException.class)
                .hasFieldOrPropertyWithValue("nodeId", "l1");
    }

    @Test
    void testGenerationFailureIsFatal() {
        LlmEngineNodeExecutor executor = new LlmEngineNodeExecutor(request -> {
            throw new CollaboratorException(CollaboratorKind.GENERATION, "HTTP 500", true);
        }, webSearchClient, new CollaboratorInvoker(properties, collaboratorExecutor), properties);

        assertThatThrownBy(() -> executor.execute(execution(Map.of(), Map.of(Ports.QUERY, "Capital?"))))
                .isInstanceOf(CollaboratorException.class)
                .satisfies(ex -> assertThat(((CollaboratorException) ex).getKind())
                        .isEqualTo(ErrorKind.COLLABORATOR_ERROR))
                .hasFieldOrPropertyWithValue("nodeId", "l1");
    }

    @Test
    void testInvalidOptionIsConfigError() {
        assertThatThrownBy(() -> execute(Map.of("maxTokens", "many"), Map.of(Ports.QUERY, "Capital?")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("maxTokens");
    }

    private Map<String, Object> execute(Map<String, Object> options, Map<String, Object> inputs) {
        LlmEngineNodeExecutor executor = new LlmEngineNodeExecutor(request -> {
            lastRequest.set(request);
            return GenerationResult.of(request.userMessage().equals("What is 2+2?") ? "4" : "Paris");
        }, webSearchClient, new CollaboratorInvoker(properties, collaboratorExecutor), properties);
        return executor.execute(execution(options, inputs));
    }

    private NodeExecution execution(Map<String, Object> options, Map<String, Object> inputs) {
        Map<String, Object> config = new LinkedHashMap<>(options);
        config.putIfAbsent("model", "gpt-4o-mini");
        WorkflowNode node = new WorkflowNode("l1", NodeType.LLM_ENGINE, NodeConfig.of(config));
        return new NodeExecution(node, NodeInputs.of(inputs), EngineTestSupport.context("ignored"));
    }
}

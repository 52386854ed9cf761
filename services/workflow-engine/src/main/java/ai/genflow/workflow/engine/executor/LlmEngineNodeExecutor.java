package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.engine.collaborator.CollaboratorException;
import ai.genflow.workflow.engine.collaborator.CollaboratorInvoker;
import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.engine.collaborator.GenerationClient;
import ai.genflow.workflow.engine.collaborator.GenerationRequest;
import ai.genflow.workflow.engine.collaborator.GenerationResult;
import ai.genflow.workflow.engine.collaborator.WebSearchClient;
import ai.genflow.workflow.engine.collaborator.WebSearchHit;
import ai.genflow.workflow.engine.config.EngineProperties;
import ai.genflow.workflow.graph.model.NodeConfig;
import ai.genflow.workflow.graph.model.NodeOptions;
import ai.genflow.workflow.graph.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Generates the answer for the query, grounded in knowledge base context and optional web results.
 *
 * <p>Web search failures degrade to no web context unless the node is strict. Generation failures
 * always fail the run. Web result URLs are published as sources.</p>
 */
@Component
public class LlmEngineNodeExecutor implements NodeExecutor {

    private static final Logger logger = LoggerFactory.getLogger(LlmEngineNodeExecutor.class);

    private final GenerationClient generationClient;
    private final WebSearchClient webSearchClient;
    private final CollaboratorInvoker invoker;
    private final EngineProperties properties;

    public LlmEngineNodeExecutor(GenerationClient generationClient, WebSearchClient webSearchClient,
                                 CollaboratorInvoker invoker, EngineProperties properties) {
        this.generationClient = generationClient;
        this.webSearchClient = webSearchClient;
        this.invoker = invoker;
        this.properties = properties;
    }

    @Override
    public NodeType type() {
        return NodeType.LLM_ENGINE;
    }

    @Override
    public Set<String> requiredInputs() {
        return Set.of(Ports.QUERY);
    }

    @Override
    public Set<String> optionalInputs() {
        return Set.of(Ports.CONTEXT);
    }

    @Override
    public Set<String> outputs() {
        return Set.of(Ports.RESPONSE, Ports.SOURCES);
    }

    @Override
    public Map<String, Object> execute(NodeExecution execution) {
        NodeConfig config = execution.config();
        String query = execution.inputs().getString(Ports.QUERY);
        String knowledgeContext = execution.inputs().getString(Ports.CONTEXT, "");

        String model = config.getString(NodeOptions.MODEL, properties.getDefaultModel());
        double temperature = config.getDouble(NodeOptions.TEMPERATURE, NodeOptions.DEFAULT_TEMPERATURE);
        int maxTokens = config.getInt(NodeOptions.MAX_TOKENS, NodeOptions.DEFAULT_MAX_TOKENS);
        String customPrompt = config.getString(NodeOptions.SYSTEM_PROMPT)
                .or(() -> config.getString(NodeOptions.PROMPT))
                .orElse(null);
        String apiKey = config.getString(NodeOptions.API_KEY).orElse(null);
        boolean strict = config.getBoolean(NodeOptions.STRICT, false);

        List<WebSearchHit> hits = List.of();
        if (config.getBoolean(NodeOptions.ENABLE_WEB_SEARCH, false)) {
            hits = searchWeb(execution, query,
                    config.getInt(NodeOptions.WEB_SEARCH_RESULTS, NodeOptions.DEFAULT_WEB_SEARCH_RESULTS), strict);
        }
        String webContext = PromptBuilder.formatWebResults(hits);

        GenerationRequest request = new GenerationRequest(
                PromptBuilder.systemPrompt(customPrompt, knowledgeContext, webContext),
                PromptBuilder.userMessage(query, knowledgeContext),
                model,
                temperature,
                maxTokens,
                apiKey);

        logger.info("Generating response nodeId={} model={} hasKnowledge={} webResults={}",
                execution.nodeId(), model, !knowledgeContext.isBlank(), hits.size());
        GenerationResult result = invoker.invoke(CollaboratorKind.GENERATION, execution.context(),
                execution.nodeId(), () -> generationClient.complete(request));
        if (result == null || result.text() == null) {
            throw new CollaboratorException(CollaboratorKind.GENERATION, execution.nodeId(),
                    "The generation service returned no completion", false, null);
        }
        logger.debug("Generation completed nodeId={} responseLength={} totalTokens={}",
                execution.nodeId(), result.text().length(), result.totalTokens());

        Set<String> sources = new LinkedHashSet<>();
        hits.stream()
                .map(WebSearchHit::url)
                .filter(url -> url != null && !url.isBlank())
                .forEach(sources::add);
        return Map.of(Ports.RESPONSE, result.text(), Ports.SOURCES, List.copyOf(sources));
    }

    private List<WebSearchHit> searchWeb(NodeExecution execution, String query, int maxResults, boolean strict) {
        try {
            List<WebSearchHit> hits = invoker.invoke(CollaboratorKind.WEB_SEARCH, execution.context(),
                    execution.nodeId(), () -> webSearchClient.search(query, maxResults));
            return hits == null ? List.of() : hits.stream().filter(Objects::nonNull).limit(maxResults).toList();
        } catch (CollaboratorException e) {
            if (strict) {
                throw e;
            }
            logger.warn("Web search failed, continuing without web context nodeId={} kind={} error={}",
                    execution.nodeId(), e.getKind(), e.getMessage());
            return List.of();
        }
    }
}

package ai.genflow.workflow.engine;

import ai.genflow.workflow.engine.config.EngineProperties;
import ai.genflow.workflow.engine.context.CancellationToken;
import ai.genflow.workflow.engine.context.ExecutionContext;
import ai.genflow.workflow.graph.model.NodeConfig;
import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowEdge;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graphs and settings shared by engine tests.
 */
public final class EngineTestSupport {

    private EngineTestSupport() {
    }

    /**
     * Short deadlines and near-zero backoff so failure paths finish quickly.
     */
    public static EngineProperties fastProperties() {
        EngineProperties properties = new EngineProperties();
        properties.setRetrievalTimeout(Duration.ofMillis(300));
        properties.setWebSearchTimeout(Duration.ofMillis(300));
        properties.setGenerationTimeout(Duration.ofMillis(300));
        properties.setMaxRetries(2);
        properties.setRetryInitialBackoff(Duration.ofMillis(1));
        properties.setRetryBackoffMultiplier(2.0);
        properties.setRetryMaxBackoff(Duration.ofMillis(5));
        return properties;
    }

    /**
     * q1 -> l1 -> o1
     */
    public static WorkflowGraph minimalGraph() {
        return WorkflowGraph.of(
                List.of(WorkflowNode.of("q1", NodeType.USER_QUERY),
                        llm("l1", Map.of()),
                        WorkflowNode.of("o1", NodeType.OUTPUT)),
                List.of(WorkflowEdge.of("q1", "l1"), WorkflowEdge.of("l1", "o1")));
    }

    /**
     * q1 -> k1 -> l1 -> o1 with q1 also feeding l1.
     */
    public static WorkflowGraph groundedGraph(Map<String, Object> knowledgeBaseConfig) {
        return WorkflowGraph.of(
                List.of(WorkflowNode.of("q1", NodeType.USER_QUERY),
                        new WorkflowNode("k1", NodeType.KNOWLEDGE_BASE, NodeConfig.of(knowledgeBaseConfig)),
                        llm("l1", Map.of()),
                        WorkflowNode.of("o1", NodeType.OUTPUT)),
                List.of(WorkflowEdge.of("q1", "k1"),
                        WorkflowEdge.of("k1", "l1"),
                        WorkflowEdge.of("q1", "l1"),
                        WorkflowEdge.of("l1", "o1")));
    }

    public static WorkflowNode llm(String id, Map<String, Object> options) {
        Map<String, Object> config = new LinkedHashMap<>(options);
        config.putIfAbsent("model", "gpt-4o-mini");
        return new WorkflowNode(id, NodeType.LLM_ENGINE, NodeConfig.of(config));
    }

    public static ExecutionContext context(String query) {
        return new ExecutionContext("run-test", "user-test", query, CancellationToken.none());
    }
}

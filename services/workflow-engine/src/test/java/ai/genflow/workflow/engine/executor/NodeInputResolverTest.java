package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.engine.context.ContextBus;
import ai.genflow.workflow.graph.exception.ConfigException;
import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowEdge;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeInputResolverTest {

    private final WorkflowNode q1 = WorkflowNode.of("q1", NodeType.USER_QUERY);
    private final WorkflowNode k1 = WorkflowNode.of("k1", NodeType.KNOWLEDGE_BASE);
    private final WorkflowNode k2 = WorkflowNode.of("k2", NodeType.KNOWLEDGE_BASE);
    private final WorkflowNode l1 = WorkflowNode.of("l1", NodeType.LLM_ENGINE);
    private final WorkflowNode o1 = WorkflowNode.of("o1", NodeType.OUTPUT);

    private NodeExecutor llmExecutor;
    private ContextBus bus;

    @BeforeEach
    void setUp() {
        llmExecutor = new LlmEngineNodeExecutor(request -> null, (query, max) -> List.of(), null, null);
        bus = new ContextBus();
        bus.publish("q1", Map.of(Ports.QUERY, "What is 2+2?"));
    }

    @Test
    void testUnnamedConnectionsFeedSameNamedPorts() {
        bus.publish("k1", Map.of(Ports.CONTEXT, "passage", Ports.SOURCES, List.of("doc-1")));
        WorkflowGraph graph = WorkflowGraph.of(List.of(q1, k1, l1, o1),
                List.of(WorkflowEdge.of("q1", "k1"), WorkflowEdge.of("k1", "l1"),
                        WorkflowEdge.of("q1", "l1"), WorkflowEdge.of("l1", "o1")));

        NodeInputs inputs = NodeInputResolver.resolve(graph, l1, llmExecutor, bus);

        assertThat(inputs.getString(Ports.QUERY)).isEqualTo("What is 2+2?");
        assertThat(inputs.getString(Ports.CONTEXT)).isEqualTo("passage");
        assertThat(inputs.has(Ports.SOURCES)).isFalse();
    }

    @Test
    void testEditorHandlesMapOntoPorts() {
        bus.publish("k1", Map.of(Ports.CONTEXT, "passage", Ports.SOURCES, List.of("doc-1")));
        WorkflowGraph graph = WorkflowGraph.of(List.of(q1, k1, l1, o1),
                List.of(new WorkflowEdge("q1", "k1", "output", "query"),
                        new WorkflowEdge("k1", "l1", "context", "context"),
                        new WorkflowEdge("q1", "l1", "output", "query"),
                        new WorkflowEdge("l1", "o1", "response", "response")));

        NodeInputs inputs = NodeInputResolver.resolve(graph, l1, llmExecutor, bus);

        assertThat(inputs.getString(Ports.QUERY)).isEqualTo("What is 2+2?");
        assertThat(inputs.getString(Ports.CONTEXT)).isEqualTo("passage");
    }

    @Test
    void testTargetHandleRestrictsConnectionToOnePort() {
        bus.publish("k1", Map.of(Ports.CONTEXT, "passage", Ports.QUERY, "rewritten"));
        WorkflowGraph graph = WorkflowGraph.of(List.of(q1, k1, l1, o1),
                List.of(WorkflowEdge.of("q1", "k1"),
                        new WorkflowEdge("k1", "l1", null, "context"),
                        WorkflowEdge.of("q1", "l1"),
                        WorkflowEdge.of("l1", "o1")));

        NodeInputs inputs = NodeInputResolver.resolve(graph, l1, llmExecutor, bus);

        assertThat(inputs.getString(Ports.QUERY)).isEqualTo("What is 2+2?");
    }

    @Test
    void testMultipleProducersAreMergedInSourceOrder() {
        bus.publish("k2", Map.of(Ports.CONTEXT, "second"));
        bus.publish("k1", Map.of(Ports.CONTEXT, "first"));
        WorkflowGraph graph = WorkflowGraph.of(List.of(q1, k1, k2, l1, o1),
                List.of(WorkflowEdge.of("q1", "k1"), WorkflowEdge.of("q1", "k2"),
                        WorkflowEdge.of("k2", "l1"), WorkflowEdge.of("k1", "l1"),
                        WorkflowEdge.of("q1", "l1"), WorkflowEdge.of("l1", "o1")));

        NodeInputs inputs = NodeInputResolver.resolve(graph, l1, llmExecutor, bus);

        assertThat(inputs.getString(Ports.CONTEXT)).isEqualTo("first\n\nsecond");
    }

    @Test
    void testRequiredInputFallsBackToSingleAncestorProducer() {
        bus.publish("k1", Map.of(Ports.CONTEXT, "passage"));
        WorkflowGraph graph = WorkflowGraph.of(List.of(q1, k1, l1, o1),
                List.of(WorkflowEdge.of("q1", "k1"), WorkflowEdge.of("k1", "l1"), WorkflowEdge.of("l1", "o1")));

        NodeInputs inputs = NodeInputResolver.resolve(graph, l1, llmExecutor, bus);

        assertThat(inputs.getString(Ports.QUERY)).isEqualTo("What is 2+2?");
    }

    @Test
    void testMissingRequiredInputIsConfigError() {
        WorkflowGraph graph = WorkflowGraph.of(List.of(q1, l1, o1),
                List.of(WorkflowEdge.of("q1", "l1"), WorkflowEdge.of("l1", "o1")));

        assertThatThrownBy(() -> NodeInputResolver.resolve(graph, o1, new OutputNodeExecutor(), bus))
                .isInstanceOf(ConfigException.class)
                .hasMessage("Output node 'o1' is missing required input 'response'")
                .hasFieldOrPropertyWithValue("nodeId", "o1");
    }

    @Test
    void testUpstreamInputsGatherFromAllAncestors() {
        bus.publish("k1", Map.of(Ports.CONTEXT, "passage", Ports.SOURCES, List.of("doc-b", "doc-a")));
        bus.publish("l1", Map.of(Ports.RESPONSE, "answer", Ports.SOURCES, List.of("https://example.com", "doc-a")));
        WorkflowGraph graph = WorkflowGraph.of(List.of(q1, k1, l1, o1),
                List.of(WorkflowEdge.of("q1", "k1"), WorkflowEdge.of("k1", "l1"),
                        WorkflowEdge.of("q1", "l1"), WorkflowEdge.of("l1", "o1")));

        NodeInputs inputs = NodeInputResolver.resolve(graph, o1, new OutputNodeExecutor(), bus);

        assertThat(inputs.getString(Ports.RESPONSE)).isEqualTo("answer");
        assertThat(inputs.getStringList(Ports.SOURCES))
                .containsExactlyInAnyOrder("doc-b", "doc-a", "https://example.com");
    }

    @Test
    void testMergeSkipsBlankText() {
        assertThat(NodeInputResolver.merge(List.of("a", " ", "b"))).isEqualTo("a\n\nb");
        assertThat(NodeInputResolver.merge(List.of())).isNull();
    }
}

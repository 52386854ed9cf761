package ai.genflow.workflow.graph.progress;

import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowEdge;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressReporterTest {

    @Test
    void testStepsFollowPresentNodeTypes() {
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(WorkflowNode.of("q1", NodeType.USER_QUERY), WorkflowNode.of("k1", NodeType.KNOWLEDGE_BASE),
                        WorkflowNode.of("l1", NodeType.LLM_ENGINE), WorkflowNode.of("o1", NodeType.OUTPUT)),
                List.of(WorkflowEdge.of("q1", "k1"), WorkflowEdge.of("k1", "l1"), WorkflowEdge.of("l1", "o1")));

        assertThat(ProgressReporter.describe(graph)).extracting(ProgressStep::title).containsExactly(
                "Processing Query", "Searching Knowledge Base", "Generating Response", "Finalizing Output");
    }

    @Test
    void testBookendsAlwaysPresent() {
        WorkflowGraph graph = WorkflowGraph.of(List.of(WorkflowNode.of("q1", NodeType.USER_QUERY)), List.of());

        assertThat(ProgressReporter.describe(graph))
                .containsExactly(ProgressReporter.PROCESSING_QUERY, ProgressReporter.FINALIZING_OUTPUT);
    }

    @Test
    void testRepeatedTypesProduceOneStep() {
        WorkflowGraph graph = WorkflowGraph.of(
                List.of(WorkflowNode.of("q1", NodeType.USER_QUERY), WorkflowNode.of("k1", NodeType.KNOWLEDGE_BASE),
                        WorkflowNode.of("k2", NodeType.KNOWLEDGE_BASE), WorkflowNode.of("l1", NodeType.LLM_ENGINE),
                        WorkflowNode.of("o1", NodeType.OUTPUT)),
                List.of());

        assertThat(ProgressReporter.describe(graph)).hasSize(4);
    }
}

package ai.genflow.workflow.graph.progress;

import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects a workflow graph onto the progress steps shown to the user while a run
 * is in flight. Pure function of the node types present; never used for control flow.
 */
public final class ProgressReporter {

    static final ProgressStep PROCESSING_QUERY = new ProgressStep("Processing Query", "Analyzing user input");
    static final ProgressStep SEARCHING_KNOWLEDGE_BASE = new ProgressStep("Searching Knowledge Base", "Finding relevant documents");
    static final ProgressStep GENERATING_RESPONSE = new ProgressStep("Generating Response", "AI is processing your request");
    static final ProgressStep FINALIZING_OUTPUT = new ProgressStep("Finalizing Output", "Preparing response");

    private ProgressReporter() {
    }

    public static List<ProgressStep> describe(WorkflowGraph graph) {
        List<ProgressStep> steps = new ArrayList<>(4);
        steps.add(PROCESSING_QUERY);
        if (graph.hasNodeType(NodeType.KNOWLEDGE_BASE)) {
            steps.add(SEARCHING_KNOWLEDGE_BASE);
        }
        if (graph.hasNodeType(NodeType.LLM_ENGINE)) {
            steps.add(GENERATING_RESPONSE);
        }
        steps.add(FINALIZING_OUTPUT);
        return List.copyOf(steps);
    }
}

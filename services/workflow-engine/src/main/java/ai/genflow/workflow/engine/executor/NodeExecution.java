package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.engine.context.ExecutionContext;
import ai.genflow.workflow.graph.model.NodeConfig;
import ai.genflow.workflow.graph.model.WorkflowNode;

/**
 * Everything an executor sees for one node: the node itself, its resolved inputs and the run context.
 */
public record NodeExecution(WorkflowNode node, NodeInputs inputs, ExecutionContext context) {

    public String nodeId() {
        return node.id();
    }

    public NodeConfig config() {
        return node.config();
    }
}

package ai.genflow.workflow.engine.service;

import ai.genflow.workflow.engine.context.ExecutionContext;
import ai.genflow.workflow.engine.context.NodeExecutionRecord;
import ai.genflow.workflow.graph.exception.WorkflowException;
import ai.genflow.workflow.graph.model.WorkflowNode;

/**
 * Observes node lifecycle events of a run. Callbacks for one run arrive in plan order.
 */
public interface WorkflowRunListener {

    default void onNodeStarted(ExecutionContext context, WorkflowNode node) {
    }

    default void onNodeCompleted(ExecutionContext context, WorkflowNode node, NodeExecutionRecord record) {
    }

    default void onNodeFailed(ExecutionContext context, WorkflowNode node, NodeExecutionRecord record,
                              WorkflowException failure) {
    }

    default void onRunFinished(ExecutionContext context, ExecutionResult result) {
    }
}

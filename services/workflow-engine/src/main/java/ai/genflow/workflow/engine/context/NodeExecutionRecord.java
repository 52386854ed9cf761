package ai.genflow.workflow.engine.context;

import ai.genflow.workflow.graph.model.NodeType;

/**
 * Execution log entry for one node.
 *
 * @param durationMs wall time spent inside the node executor
 * @param collaboratorMs part of {@code durationMs} spent waiting on collaborators
 */
public record NodeExecutionRecord(
        String nodeId,
        NodeType nodeType,
        NodeExecutionStatus status,
        long durationMs,
        long collaboratorMs
) {
}

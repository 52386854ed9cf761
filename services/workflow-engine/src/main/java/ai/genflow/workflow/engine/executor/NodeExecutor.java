package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.graph.model.NodeType;

import java.util.Map;
import java.util.Set;

/**
 * Executes one node type.
 *
 * <p>Executors declare the ports they read and write. Required inputs must be resolvable before
 * the executor runs; optional inputs may be absent. Upstream inputs are gathered from every
 * ancestor of the node rather than from direct connections only.</p>
 */
public interface NodeExecutor {

    NodeType type();

    Set<String> requiredInputs();

    default Set<String> optionalInputs() {
        return Set.of();
    }

    default Set<String> upstreamInputs() {
        return Set.of();
    }

    Set<String> outputs();

    /**
     * @return values keyed by output port
     * @throws ai.genflow.workflow.graph.exception.WorkflowException when the node cannot produce its outputs
     */
    Map<String, Object> execute(NodeExecution execution);
}

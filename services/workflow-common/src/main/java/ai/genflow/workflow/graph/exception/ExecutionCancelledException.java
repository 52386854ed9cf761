package ai.genflow.workflow.graph.exception;

/**
 * A run was stopped at a node boundary because the caller cancelled it.
 */
public class ExecutionCancelledException extends WorkflowException {

    public ExecutionCancelledException(String runId, String nextNodeId) {
        super(ErrorKind.CANCELLED, nextNodeId, "Run '" + runId + "' was cancelled before node '" + nextNodeId + "' started");
    }
}

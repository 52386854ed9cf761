package ai.genflow.workflow.graph.exception;

/**
 * A node failed for a reason outside the workflow error taxonomy, such as a defect in an
 * executor or a collaborator returning malformed data.
 */
public class NodeExecutionException extends WorkflowException {

    public NodeExecutionException(String nodeId, String message, Throwable cause) {
        super(ErrorKind.INTERNAL_ERROR, nodeId, message, cause);
    }
}

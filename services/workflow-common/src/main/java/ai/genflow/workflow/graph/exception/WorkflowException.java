package ai.genflow.workflow.graph.exception;

/**
 * Base type for every failure the workflow engine reports to a caller.
 *
 * <p>Carries the error classification and, when the failure is attributable to a
 * single node, that node's id.</p>
 */
public abstract class WorkflowException extends RuntimeException {

    private final ErrorKind kind;
    private final String nodeId;

    protected WorkflowException(ErrorKind kind, String nodeId, String message) {
        super(message);
        this.kind = kind;
        this.nodeId = nodeId;
    }

    protected WorkflowException(ErrorKind kind, String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.nodeId = nodeId;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the failing node id, or {@code null} when the failure is graph-wide
     */
    public String getNodeId() {
        return nodeId;
    }
}

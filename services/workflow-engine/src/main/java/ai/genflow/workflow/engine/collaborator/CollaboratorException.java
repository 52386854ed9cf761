package ai.genflow.workflow.engine.collaborator;

import ai.genflow.workflow.graph.exception.ErrorKind;
import ai.genflow.workflow.graph.exception.WorkflowException;

/**
 * A collaborator call failed.
 *
 * <p>Clients raise it without a node id; {@link CollaboratorInvoker} attaches the id of the node
 * that made the call. {@code transientFailure} marks failures that are worth retrying, such as
 * I/O errors and 5xx responses.</p>
 */
public class CollaboratorException extends WorkflowException {

    private final CollaboratorKind collaborator;
    private final boolean transientFailure;

    public CollaboratorException(CollaboratorKind collaborator, String message, boolean transientFailure) {
        this(collaborator, null, message, transientFailure, null);
    }

    public CollaboratorException(CollaboratorKind collaborator, String message, boolean transientFailure,
                                 Throwable cause) {
        this(collaborator, null, message, transientFailure, cause);
    }

    public CollaboratorException(CollaboratorKind collaborator, String nodeId, String message,
                                 boolean transientFailure, Throwable cause) {
        this(ErrorKind.COLLABORATOR_ERROR, collaborator, nodeId, message, transientFailure, cause);
    }

    protected CollaboratorException(ErrorKind kind, CollaboratorKind collaborator, String nodeId, String message,
                                    boolean transientFailure, Throwable cause) {
        super(kind, nodeId, message, cause);
        this.collaborator = collaborator;
        this.transientFailure = transientFailure;
    }

    public CollaboratorKind getCollaborator() {
        return collaborator;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    /**
     * Returns this failure attributed to {@code nodeId}.
     */
    public CollaboratorException forNode(String nodeId) {
        if (nodeId == null || nodeId.equals(getNodeId())) {
            return this;
        }
        return new CollaboratorException(collaborator, nodeId, getMessage(), transientFailure, getCause());
    }
}

package ai.genflow.workflow.engine.collaborator;

import ai.genflow.workflow.graph.exception.ErrorKind;

import java.time.Duration;

/**
 * A collaborator did not answer within its configured deadline.
 */
public class CollaboratorTimeoutException extends CollaboratorException {

    private final Duration timeout;

    public CollaboratorTimeoutException(CollaboratorKind collaborator, String nodeId, Duration timeout,
                                        Throwable cause) {
        super(ErrorKind.COLLABORATOR_TIMEOUT, collaborator, nodeId,
                "The " + collaborator.label() + " service did not respond within " + timeout.toMillis() + " ms",
                true, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public CollaboratorException forNode(String nodeId) {
        if (nodeId == null || nodeId.equals(getNodeId())) {
            return this;
        }
        return new CollaboratorTimeoutException(getCollaborator(), nodeId, timeout, getCause());
    }
}

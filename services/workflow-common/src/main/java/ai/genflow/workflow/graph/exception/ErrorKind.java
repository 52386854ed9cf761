package ai.genflow.workflow.graph.exception;

/**
 * Classification of a failed validation or execution, reported to callers.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    CYCLE_DETECTED,
    CONFIG_ERROR,
    COLLABORATOR_TIMEOUT,
    COLLABORATOR_ERROR,
    CANCELLED,
    INTERNAL_ERROR
}

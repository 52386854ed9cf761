package ai.genflow.workflow.engine.service;

import ai.genflow.workflow.graph.exception.ErrorKind;
import ai.genflow.workflow.graph.exception.GraphValidationException;
import ai.genflow.workflow.graph.exception.WorkflowException;
import ai.genflow.workflow.graph.validation.ValidationResult;

import java.util.List;

/**
 * Classified reason a run produced no response.
 *
 * @param nodeId failing node, {@code null} for graph-wide failures
 * @param errors individual validation errors, empty for other kinds
 */
public record ExecutionFailure(ErrorKind kind, String nodeId, String message, List<String> errors) {

    public ExecutionFailure {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ExecutionFailure fromValidation(ValidationResult validation) {
        ErrorKind kind = validation.hasCycle() ? ErrorKind.CYCLE_DETECTED : ErrorKind.VALIDATION_ERROR;
        return new ExecutionFailure(kind, null, String.join("; ", validation.errors()), validation.errors());
    }

    public static ExecutionFailure from(WorkflowException exception, String nodeId) {
        List<String> errors = exception instanceof GraphValidationException validation
                ? validation.getErrors()
                : List.of();
        String failingNode = exception.getNodeId() != null ? exception.getNodeId() : nodeId;
        return new ExecutionFailure(exception.getKind(), failingNode, exception.getMessage(), errors);
    }
}

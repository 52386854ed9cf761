package ai.genflow.workflow.graph.exception;

import java.util.List;

/**
 * Thrown when a workflow graph fails structural or semantic validation.
 */
public class GraphValidationException extends WorkflowException {

    private final List<String> errors;

    public GraphValidationException(List<String> errors) {
        this(ErrorKind.VALIDATION_ERROR, errors);
    }

    protected GraphValidationException(ErrorKind kind, List<String> errors) {
        super(kind, null, "Workflow validation failed: " + String.join("; ", errors == null ? List.of() : errors));
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

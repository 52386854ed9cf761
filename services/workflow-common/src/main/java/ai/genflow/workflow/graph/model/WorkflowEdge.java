package ai.genflow.workflow.graph.model;

/**
 * Directed connection from one node's output to another node's input.
 *
 * <p>Handles are optional port names; when absent the connection offers every
 * output of the source node to the same-named inputs of the target.</p>
 */
public record WorkflowEdge(
        String source,
        String target,
        String sourceHandle,
        String targetHandle
) {
    public WorkflowEdge {
        if (source == null || source.trim().isEmpty()) {
            throw new IllegalArgumentException("Edge source cannot be null or empty");
        }
        if (target == null || target.trim().isEmpty()) {
            throw new IllegalArgumentException("Edge target cannot be null or empty");
        }
        sourceHandle = blankToNull(sourceHandle);
        targetHandle = blankToNull(targetHandle);
    }

    public static WorkflowEdge of(String source, String target) {
        return new WorkflowEdge(source, target, null, null);
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

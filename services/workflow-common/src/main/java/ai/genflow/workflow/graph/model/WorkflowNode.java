package ai.genflow.workflow.graph.model;

/**
 * One typed processing step of a workflow graph.
 *
 * @param id unique node identifier
 * @param type node type
 * @param config per-node options, schema depends on {@code type}
 */
public record WorkflowNode(String id, NodeType type, NodeConfig config) {

    public WorkflowNode {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Node type cannot be null");
        }
        if (config == null) {
            config = NodeConfig.empty();
        }
    }

    public static WorkflowNode of(String id, NodeType type) {
        return new WorkflowNode(id, type, NodeConfig.empty());
    }

    public String describe() {
        return type.displayName() + " node '" + id + "'";
    }
}

package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.graph.model.NodeType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps every node type to its executor. Construction fails unless each type has exactly one.
 */
@Component
public class NodeExecutorRegistry {

    private final Map<NodeType, NodeExecutor> executors = new EnumMap<>(NodeType.class);

    public NodeExecutorRegistry(Collection<NodeExecutor> executors) {
        for (NodeExecutor executor : executors) {
            NodeExecutor previous = this.executors.putIfAbsent(executor.type(), executor);
            if (previous != null) {
                throw new IllegalStateException("Multiple executors registered for node type " + executor.type()
                        + ": " + previous.getClass().getSimpleName() + ", " + executor.getClass().getSimpleName());
            }
        }
        List<NodeType> missing = Arrays.stream(NodeType.values())
                .filter(type -> !this.executors.containsKey(type))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No executor registered for node types " + missing);
        }
    }

    public NodeExecutor get(NodeType type) {
        return executors.get(type);
    }
}

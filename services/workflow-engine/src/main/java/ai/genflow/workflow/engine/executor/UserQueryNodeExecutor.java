package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.graph.exception.ConfigException;
import ai.genflow.workflow.graph.model.NodeType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Entry node: publishes the run's query.
 */
@Component
public class UserQueryNodeExecutor implements NodeExecutor {

    @Override
    public NodeType type() {
        return NodeType.USER_QUERY;
    }

    @Override
    public Set<String> requiredInputs() {
        return Set.of();
    }

    @Override
    public Set<String> outputs() {
        return Set.of(Ports.QUERY);
    }

    @Override
    public Map<String, Object> execute(NodeExecution execution) {
        String query = execution.context().getQuery();
        if (query == null || query.isBlank()) {
            throw new ConfigException(execution.nodeId(),
                    execution.node().describe() + " has no query to process");
        }
        return Map.of(Ports.QUERY, query.strip());
    }
}

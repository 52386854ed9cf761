package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.graph.model.NodeOptions;
import ai.genflow.workflow.graph.model.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Terminal node: pairs the generated response with the sorted citations gathered upstream.
 */
@Component
public class OutputNodeExecutor implements NodeExecutor {

    @Override
    public NodeType type() {
        return NodeType.OUTPUT;
    }

    @Override
    public Set<String> requiredInputs() {
        return Set.of(Ports.RESPONSE);
    }

    @Override
    public Set<String> upstreamInputs() {
        return Set.of(Ports.SOURCES);
    }

    @Override
    public Set<String> outputs() {
        return Set.of(Ports.RESULT);
    }

    @Override
    public Map<String, Object> execute(NodeExecution execution) {
        String response = execution.inputs().getString(Ports.RESPONSE);
        List<String> sources = List.of();
        if (execution.config().getBoolean(NodeOptions.SHOW_SOURCES, NodeOptions.DEFAULT_SHOW_SOURCES)) {
            sources = List.copyOf(new TreeSet<>(execution.inputs().getStringList(Ports.SOURCES)));
        }
        return Map.of(Ports.RESULT, new FinalOutput(response, sources));
    }
}

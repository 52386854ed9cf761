package ai.genflow.workflow.engine.executor;

import java.util.List;

/**
 * Value an Output node publishes on its {@code result} port.
 */
public record FinalOutput(String response, List<String> sources) {

    public FinalOutput {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}

package ai.genflow.workflow.engine.collaborator;

import java.time.Instant;
import java.util.List;

/**
 * A completed exchange recorded for a user.
 */
public record HistoryMessage(String query, String response, List<String> sources, Instant timestamp) {

    public HistoryMessage {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}

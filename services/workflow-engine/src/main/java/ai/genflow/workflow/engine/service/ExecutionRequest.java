package ai.genflow.workflow.engine.service;

import java.util.UUID;

/**
 * Input of one run.
 *
 * @param runId caller-chosen id, generated when blank
 * @param userId owner of the conversation, used for history; may be {@code null}
 */
public record ExecutionRequest(String runId, String userId, String query) {

    public ExecutionRequest {
        if (runId == null || runId.isBlank()) {
            runId = UUID.randomUUID().toString();
        }
    }

    public static ExecutionRequest of(String query) {
        return new ExecutionRequest(null, null, query);
    }

    public static ExecutionRequest of(String userId, String query) {
        return new ExecutionRequest(null, userId, query);
    }
}

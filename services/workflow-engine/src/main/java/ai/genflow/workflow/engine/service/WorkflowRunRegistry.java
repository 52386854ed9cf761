package ai.genflow.workflow.engine.service;

import ai.genflow.workflow.engine.context.CancellationToken;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation handles of in-flight runs, keyed by run id.
 */
@Component
public class WorkflowRunRegistry {

    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    public CancellationToken register(String runId) {
        CancellationToken token = new CancellationToken();
        if (activeRuns.putIfAbsent(runId, token) != null) {
            throw new IllegalArgumentException("Run '" + runId + "' is already in progress");
        }
        return token;
    }

    /**
     * @return {@code false} when no run with that id is in flight
     */
    public boolean cancel(String runId) {
        CancellationToken token = activeRuns.get(runId);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public void release(String runId) {
        activeRuns.remove(runId);
    }

    public boolean isActive(String runId) {
        return activeRuns.containsKey(runId);
    }
}

package ai.genflow.workflow.engine.service;

import ai.genflow.workflow.engine.context.NodeExecutionRecord;

import java.util.List;

/**
 * Outcome of a run. Exactly one of {@code response} and {@code failure} is set; a failed run
 * never carries a partial response or citations.
 *
 * @param executionTimeMs sum of node executor durations
 */
public record ExecutionResult(
        String runId,
        String response,
        List<String> sources,
        long executionTimeMs,
        List<NodeExecutionRecord> executionLog,
        ExecutionFailure failure
) {
    public ExecutionResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        executionLog = executionLog == null ? List.of() : List.copyOf(executionLog);
    }

    public static ExecutionResult succeeded(String runId, String response, List<String> sources,
                                            long executionTimeMs, List<NodeExecutionRecord> executionLog) {
        return new ExecutionResult(runId, response, sources, executionTimeMs, executionLog, null);
    }

    public static ExecutionResult failed(String runId, ExecutionFailure failure, long executionTimeMs,
                                         List<NodeExecutionRecord> executionLog) {
        return new ExecutionResult(runId, null, List.of(), executionTimeMs, executionLog, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}

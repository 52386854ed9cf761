package ai.genflow.workflow.engine.context;

import ai.genflow.workflow.graph.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State owned by a single run. Created when the run starts and discarded when it ends.
 */
public class ExecutionContext {

    private final String runId;
    private final String userId;
    private final String query;
    private final CancellationToken cancellation;
    private final ContextBus bus = new ContextBus();
    private final List<NodeExecutionRecord> records = new ArrayList<>();
    private final Map<String, AtomicLong> collaboratorNanosByNode = new ConcurrentHashMap<>();
    private final AtomicLong executorNanos = new AtomicLong();

    public ExecutionContext(String runId, String userId, String query, CancellationToken cancellation) {
        this.runId = runId;
        this.userId = userId;
        this.query = query;
        this.cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }

    public String getRunId() {
        return runId;
    }

    public String getUserId() {
        return userId;
    }

    public String getQuery() {
        return query;
    }

    public ContextBus getBus() {
        return bus;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    public void recordCollaboratorLatency(String nodeId, long nanos) {
        collaboratorNanosByNode.computeIfAbsent(nodeId, ignored -> new AtomicLong()).addAndGet(nanos);
    }

    public long collaboratorNanos(String nodeId) {
        AtomicLong nanos = collaboratorNanosByNode.get(nodeId);
        return nanos == null ? 0L : nanos.get();
    }

    /**
     * Appends a log entry and adds the node's executor time to the run total.
     */
    public NodeExecutionRecord recordNode(String nodeId, NodeType type, NodeExecutionStatus status, long nanos) {
        executorNanos.addAndGet(nanos);
        NodeExecutionRecord record = new NodeExecutionRecord(nodeId, type, status,
                TimeUnit.NANOSECONDS.toMillis(nanos), TimeUnit.NANOSECONDS.toMillis(collaboratorNanos(nodeId)));
        synchronized (records) {
            records.add(record);
        }
        return record;
    }

    public List<NodeExecutionRecord> getRecords() {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    /**
     * Sum of executor durations in milliseconds, rounded up so any executed node reports a positive time.
     */
    public long executionTimeMs() {
        long nanos = executorNanos.get();
        return nanos == 0 ? 0 : (nanos + 999_999) / 1_000_000;
    }
}

package ai.genflow.workflow.engine.context;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one run. Checked between nodes; in-flight collaborator calls finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

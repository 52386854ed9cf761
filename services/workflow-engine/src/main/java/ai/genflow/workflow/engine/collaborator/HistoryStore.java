package ai.genflow.workflow.engine.collaborator;

/**
 * Append-only record of completed runs per user. Failures never affect the run that produced the message.
 */
public interface HistoryStore {

    void append(String userId, HistoryMessage message);
}

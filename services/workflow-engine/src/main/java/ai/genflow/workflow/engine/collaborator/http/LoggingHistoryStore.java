package ai.genflow.workflow.engine.collaborator.http;

import ai.genflow.workflow.engine.collaborator.HistoryMessage;
import ai.genflow.workflow.engine.collaborator.HistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * History sink used when no history service is configured.
 */
public class LoggingHistoryStore implements HistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(LoggingHistoryStore.class);

    @Override
    public void append(String userId, HistoryMessage message) {
        logger.info("Chat history userId={} sources={} responseLength={}",
                userId, message.sources().size(), message.response() == null ? 0 : message.response().length());
    }
}

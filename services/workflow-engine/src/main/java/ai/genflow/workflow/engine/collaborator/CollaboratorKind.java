package ai.genflow.workflow.engine.collaborator;

/**
 * External services invoked during execution.
 */
public enum CollaboratorKind {
    RETRIEVAL("retrieval", true),
    WEB_SEARCH("web search", true),
    GENERATION("generation", false);

    private final String label;
    private final boolean retryable;

    CollaboratorKind(String label, boolean retryable) {
        this.label = label;
        this.retryable = retryable;
    }

    public String label() {
        return label;
    }

    /**
     * Whether failed calls may be retried. Generation is never retried because it is not idempotent.
     */
    public boolean isRetryable() {
        return retryable;
    }
}

package ai.genflow.workflow.graph.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of processing steps a workflow graph may contain.
 */
public enum NodeType {
    USER_QUERY("user_query", "User Query"),
    KNOWLEDGE_BASE("knowledge_base", "Knowledge Base"),
    LLM_ENGINE("llm_engine", "LLM Engine"),
    OUTPUT("output", "Output");

    private final String wireName;
    private final String displayName;

    NodeType(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves an editor type string. Accepts the snake_case wire names
     * ({@code llm_engine}) and the component names ({@code LLMEngine}), ignoring case.
     *
     * @param value raw type string from the editor payload
     * @return the matching type, or empty when the string names no known type
     */
    public static Optional<NodeType> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.wireName.replace("_", "").equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

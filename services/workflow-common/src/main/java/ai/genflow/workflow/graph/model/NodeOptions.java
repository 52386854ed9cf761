package ai.genflow.workflow.graph.model;

/**
 * Configuration option names understood by each node type, with their defaults.
 */
public final class NodeOptions {

    public static final String STRICT = "strict";

    // UserQuery
    public static final String QUERY_PLACEHOLDER = "query";

    // KnowledgeBase
    public static final String DOCUMENT_ID = "documentId";
    public static final String SELECTED_DOCUMENTS = "selectedDocuments";
    public static final String MAX_RESULTS = "maxResults";
    public static final String SIMILARITY_THRESHOLD = "similarityThreshold";
    public static final int DEFAULT_MAX_RESULTS = 5;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;

    // LLMEngine
    public static final String MODEL = "model";
    public static final String TEMPERATURE = "temperature";
    public static final String MAX_TOKENS = "maxTokens";
    public static final String SYSTEM_PROMPT = "systemPrompt";
    public static final String PROMPT = "prompt";
    public static final String ENABLE_WEB_SEARCH = "enableWebSearch";
    public static final String WEB_SEARCH_RESULTS = "webSearchResults";
    public static final String API_KEY = "apiKey";
    public static final String DEFAULT_MODEL = "gpt-3.5-turbo";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final int DEFAULT_WEB_SEARCH_RESULTS = 3;

    // Output
    public static final String SHOW_SOURCES = "showSources";
    public static final boolean DEFAULT_SHOW_SOURCES = true;

    private NodeOptions() {
    }
}

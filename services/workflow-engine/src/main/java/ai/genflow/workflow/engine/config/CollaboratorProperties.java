package ai.genflow.workflow.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints and credentials of the external services the engine calls.
 */
@ConfigurationProperties(prefix = "genflow.collaborators")
public class CollaboratorProperties {

    private Retrieval retrieval = new Retrieval();
    private Generation generation = new Generation();
    private WebSearch webSearch = new WebSearch();
    private History history = new History();

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(Retrieval retrieval) {
        this.retrieval = retrieval;
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation;
    }

    public WebSearch getWebSearch() {
        return webSearch;
    }

    public void setWebSearch(WebSearch webSearch) {
        this.webSearch = webSearch;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public static class Retrieval {

        private String baseUrl = "http://localhost:8000/api/embeddings";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Generation {

        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    /**
     * Web search provider selection: {@code none}, {@code serpapi} or {@code brave}.
     */
    public static class WebSearch {

        private String provider = "none";
        private String apiKey = "";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    /**
     * Chat history sink; history is only logged when no base URL is set.
     */
    public static class History {

        private String baseUrl = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}

package ai.genflow.workflow.engine.collaborator.http;

import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.engine.collaborator.RetrievalClient;
import ai.genflow.workflow.engine.collaborator.RetrievedPassage;
import ai.genflow.workflow.engine.config.CollaboratorProperties;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Objects;

/**
 * Retrieval client for the document embedding service.
 */
public class HttpRetrievalClient implements RetrievalClient {

    private final RestClient restClient;

    public HttpRetrievalClient(CollaboratorProperties properties, RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder
                .baseUrl(CollaboratorHttpErrors.normalizeBaseUrl(properties.getRetrieval().getBaseUrl(),
                        "http://localhost:8000/api/embeddings"))
                .build();
    }

    @Override
    public List<RetrievedPassage> search(String query, String documentId, int maxResults, double similarityThreshold) {
        try {
            SearchResponse response = restClient.post()
                    .uri("/search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new SearchRequest(query, documentId, maxResults, similarityThreshold))
                    .retrieve()
                    .body(SearchResponse.class);
            if (response == null || response.results() == null) {
                return List.of();
            }
            return response.results().stream()
                    .filter(Objects::nonNull)
                    .map(result -> new RetrievedPassage(result.content(),
                            result.sourceId() != null ? result.sourceId() : documentId,
                            result.score() == null ? 0.0 : result.score()))
                    .toList();
        } catch (RestClientException ex) {
            throw CollaboratorHttpErrors.translate(CollaboratorKind.RETRIEVAL, ex);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SearchRequest(
            String query,
            @JsonProperty("document_id") String documentId,
            @JsonProperty("n_results") int maxResults,
            @JsonProperty("similarity_threshold") double similarityThreshold
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<SearchResult> results) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResult(
            @JsonAlias("text") String content,
            @JsonProperty("source_id") @JsonAlias({"document_id", "source"}) String sourceId,
            @JsonAlias("similarity") Double score
    ) {
    }
}

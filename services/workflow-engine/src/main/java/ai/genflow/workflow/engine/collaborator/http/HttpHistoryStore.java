package ai.genflow.workflow.engine.collaborator.http;

import ai.genflow.workflow.engine.collaborator.HistoryMessage;
import ai.genflow.workflow.engine.collaborator.HistoryStore;
import ai.genflow.workflow.engine.config.CollaboratorProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.List;

/**
 * Posts completed exchanges to the chat history service.
 */
public class HttpHistoryStore implements HistoryStore {

    private final RestClient restClient;

    public HttpHistoryStore(CollaboratorProperties properties, RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder
                .baseUrl(CollaboratorHttpErrors.normalizeBaseUrl(properties.getHistory().getBaseUrl(),
                        "http://localhost:8000/api/chat"))
                .build();
    }

    @Override
    public void append(String userId, HistoryMessage message) {
        try {
            restClient.post()
                    .uri("/save")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new SaveRequest(userId, message.query(), message.response(), message.sources(),
                            message.timestamp()))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException ex) {
            throw new IllegalStateException("Failed to store chat history for userId=" + userId, ex);
        }
    }

    record SaveRequest(
            @JsonProperty("user_id") String userId,
            String query,
            String response,
            List<String> sources,
            Instant timestamp
    ) {
    }
}

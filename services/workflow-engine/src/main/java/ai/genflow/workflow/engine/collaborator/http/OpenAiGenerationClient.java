package ai.genflow.workflow.engine.collaborator.http;

import ai.genflow.workflow.engine.collaborator.CollaboratorException;
import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.engine.collaborator.GenerationClient;
import ai.genflow.workflow.engine.collaborator.GenerationRequest;
import ai.genflow.workflow.engine.collaborator.GenerationResult;
import ai.genflow.workflow.engine.config.CollaboratorProperties;
import ai.genflow.workflow.graph.exception.ConfigException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Generation client speaking the OpenAI chat-completions protocol.
 */
public class OpenAiGenerationClient implements GenerationClient {

    private final RestClient restClient;
    private final String defaultApiKey;

    public OpenAiGenerationClient(CollaboratorProperties properties, RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder
                .baseUrl(CollaboratorHttpErrors.normalizeBaseUrl(properties.getGeneration().getBaseUrl(),
                        "https://api.openai.com"))
                .build();
        this.defaultApiKey = properties.getGeneration().getApiKey();
    }

    @Override
    public GenerationResult complete(GenerationRequest request) {
        String apiKey = request.apiKey() != null && !request.apiKey().isBlank() ? request.apiKey() : defaultApiKey;
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigException(null, "No API key configured for the generation service");
        }

        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(new ChatMessage("system", request.systemPrompt()));
        }
        messages.add(new ChatMessage("user", request.userMessage()));

        ChatCompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/v1/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ChatCompletionRequest(request.model(), messages, request.temperature(),
                            request.maxTokens()))
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientException ex) {
            throw CollaboratorHttpErrors.translate(CollaboratorKind.GENERATION, ex);
        }

        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null
                || response.choices().get(0).message().content() == null) {
            throw new CollaboratorException(CollaboratorKind.GENERATION,
                    "The generation service returned no completion", false);
        }
        int totalTokens = response.usage() == null ? 0 : response.usage().totalTokens();
        return new GenerationResult(response.choices().get(0).message().content(), totalTokens);
    }

    record ChatCompletionRequest(
            String model,
            List<ChatMessage> messages,
            double temperature,
            @JsonProperty("max_tokens") int maxTokens
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatMessage(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices, Usage usage) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(ChatMessage message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Usage(@JsonProperty("total_tokens") int totalTokens) {
    }
}

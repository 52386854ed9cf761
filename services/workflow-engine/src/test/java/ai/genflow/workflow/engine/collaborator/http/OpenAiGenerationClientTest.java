package ai.genflow.workflow.engine.collaborator.http;

import ai.genflow.workflow.engine.collaborator.CollaboratorException;
import ai.genflow.workflow.engine.collaborator.GenerationRequest;
import ai.genflow.workflow.engine.collaborator.GenerationResult;
import ai.genflow.workflow.engine.config.CollaboratorProperties;
import ai.genflow.workflow.graph.exception.ConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiGenerationClientTest {

    private CollaboratorProperties properties;
    private RestClient.Builder builder;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        properties = new CollaboratorProperties();
        properties.getGeneration().setBaseUrl("http://llm.local");
        properties.getGeneration().setApiKey("sk-default");
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    void testSendsChatCompletionWithNodeKey() {
        server.expect(requestTo("http://llm.local/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-node"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.max_tokens").value(256))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("What is 2+2?"))
                .andRespond(withSuccess("""
                        {"choices": [{"message": {"role": "assistant", "content": "4"}}],
                         "usage": {"total_tokens": 21}}
                        """, MediaType.APPLICATION_JSON));
        OpenAiGenerationClient client = new OpenAiGenerationClient(properties, builder);

        GenerationResult result = client.complete(new GenerationRequest("Be brief.", "What is 2+2?",
                "gpt-4o-mini", 0.2, 256, "sk-node"));

        assertThat(result.text()).isEqualTo("4");
        assertThat(result.totalTokens()).isEqualTo(21);
        server.verify();
    }

    @Test
    void testFallsBackToConfiguredKey() {
        server.expect(requestTo("http://llm.local/v1/chat/completions"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-default"))
                .andRespond(withSuccess("{\"choices\": [{\"message\": {\"content\": \"ok\"}}]}",
                        MediaType.APPLICATION_JSON));
        OpenAiGenerationClient client = new OpenAiGenerationClient(properties, builder);

        assertThat(client.complete(new GenerationRequest(null, "hi", "gpt-4o-mini", 0.7, 10, null)).text())
                .isEqualTo("ok");
    }

    @Test
    void testMissingKeyIsConfigError() {
        properties.getGeneration().setApiKey("");
        OpenAiGenerationClient client = new OpenAiGenerationClient(properties, builder);

        assertThatThrownBy(() -> client.complete(new GenerationRequest(null, "hi", "gpt-4o-mini", 0.7, 10, " ")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void testEmptyChoicesIsCollaboratorError() {
        server.expect(requestTo("http://llm.local/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));
        OpenAiGenerationClient client = new OpenAiGenerationClient(properties, builder);

        assertThatThrownBy(() -> client.complete(new GenerationRequest(null, "hi", "gpt-4o-mini", 0.7, 10, null)))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("no completion");
    }
}

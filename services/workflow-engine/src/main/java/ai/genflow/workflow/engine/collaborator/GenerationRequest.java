package ai.genflow.workflow.engine.collaborator;

/**
 * Chat-completion request assembled by an LLM Engine node.
 *
 * @param apiKey per-node credential; {@code null} falls back to the configured key
 */
public record GenerationRequest(
        String systemPrompt,
        String userMessage,
        String model,
        double temperature,
        int maxTokens,
        String apiKey
) {
}

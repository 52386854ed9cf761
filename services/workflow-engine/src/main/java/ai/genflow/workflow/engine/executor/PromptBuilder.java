package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.engine.collaborator.WebSearchHit;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the system prompt and user message an LLM Engine node sends to the generation service.
 */
public final class PromptBuilder {

    static final String NOT_IN_DOCUMENTS = "I don't have that information in the uploaded documents.";

    static final String DEFAULT_PROMPT =
            "You are a helpful AI assistant. Answer the user's question to the best of your ability.";

    static final String GROUNDED_PROMPT =
            "You are a helpful AI assistant. You MUST use ONLY the context provided below to answer questions. "
                    + "DO NOT use your general knowledge or training data. "
                    + "If the answer is not found in the provided context, respond with '" + NOT_IN_DOCUMENTS + "' "
                    + "Always base your answers strictly on the provided context.";

    static final String GROUNDING_RULES = """

            CRITICAL INSTRUCTIONS:
            - ONLY use information from the context provided above
            - DO NOT use any information from your training data
            - If the context contains the answer, use it exactly as provided
            - If the context doesn't contain the answer, say '%s'
            - Be specific and accurate based only on the provided context
            - Do not make assumptions or add information not in the context""".formatted(NOT_IN_DOCUMENTS);

    private PromptBuilder() {
    }

    public static String systemPrompt(String customPrompt, String knowledgeContext, String webContext) {
        boolean hasKnowledge = hasText(knowledgeContext);
        boolean hasWeb = hasText(webContext);

        List<String> parts = new ArrayList<>();
        if (hasText(customPrompt)) {
            parts.add(customPrompt.strip());
        } else {
            parts.add(hasKnowledge || hasWeb ? GROUNDED_PROMPT : DEFAULT_PROMPT);
        }
        if (hasKnowledge) {
            parts.add("\n--- KNOWLEDGE BASE CONTEXT ---\n" + knowledgeContext);
            parts.add("--- END KNOWLEDGE BASE CONTEXT ---");
        }
        if (hasWeb) {
            parts.add("\n--- WEB SEARCH CONTEXT ---\n" + webContext);
            parts.add("--- END WEB SEARCH CONTEXT ---");
        }
        if (hasKnowledge || hasWeb) {
            parts.add(GROUNDING_RULES);
        }
        return String.join("\n", parts);
    }

    /**
     * Without knowledge context the query is sent unchanged.
     */
    public static String userMessage(String query, String knowledgeContext) {
        if (!hasText(knowledgeContext)) {
            return query;
        }
        return "Context from uploaded documents:\n"
                + knowledgeContext
                + "\n\nQuestion: " + query
                + "\n\nPlease answer the question using ONLY the context provided above. "
                + "If the answer is not in the context, please say \"" + NOT_IN_DOCUMENTS + "\" "
                + "Do not use your general knowledge.";
    }

    public static String formatWebResults(List<WebSearchHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder("=== WEB SEARCH RESULTS ===\n");
        for (int i = 0; i < hits.size(); i++) {
            WebSearchHit hit = hits.get(i);
            builder.append('\n').append(i + 1).append(". ").append(hit.title()).append('\n');
            builder.append("   URL: ").append(hit.url()).append('\n');
            builder.append("   Summary: ").append(hit.snippet()).append('\n');
        }
        builder.append("\n=== END WEB SEARCH RESULTS ===\n");
        return builder.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

package ai.genflow.workflow.engine.collaborator;

public record GenerationResult(String text, int totalTokens) {

    public static GenerationResult of(String text) {
        return new GenerationResult(text, 0);
    }
}

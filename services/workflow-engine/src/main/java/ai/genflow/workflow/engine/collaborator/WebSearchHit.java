package ai.genflow.workflow.engine.collaborator;

public record WebSearchHit(String title, String snippet, String url) {
}

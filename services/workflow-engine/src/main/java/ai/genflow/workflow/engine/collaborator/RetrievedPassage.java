package ai.genflow.workflow.engine.collaborator;

/**
 * One passage returned by the retrieval service.
 *
 * @param content passage text
 * @param sourceId identifier of the document the passage came from
 * @param score similarity in [0, 1], higher is closer
 */
public record RetrievedPassage(String content, String sourceId, double score) {
}

package ai.genflow.workflow.engine.collaborator;

import java.util.List;

/**
 * Vector search over uploaded documents.
 */
public interface RetrievalClient {

    /**
     * @param documentId restricts the search to one document, or {@code null} for the whole store
     */
    List<RetrievedPassage> search(String query, String documentId, int maxResults, double similarityThreshold);
}

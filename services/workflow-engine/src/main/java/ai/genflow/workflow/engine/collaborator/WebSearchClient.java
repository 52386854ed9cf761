package ai.genflow.workflow.engine.collaborator;

import java.util.List;

public interface WebSearchClient {

    List<WebSearchHit> search(String query, int maxResults);
}

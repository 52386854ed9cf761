package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.engine.collaborator.CollaboratorException;
import ai.genflow.workflow.engine.collaborator.CollaboratorInvoker;
import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.engine.collaborator.RetrievalClient;
import ai.genflow.workflow.engine.collaborator.RetrievedPassage;
import ai.genflow.workflow.graph.model.NodeConfig;
import ai.genflow.workflow.graph.model.NodeOptions;
import ai.genflow.workflow.graph.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Retrieves passages relevant to the query and publishes them as grounding context.
 *
 * <p>When documents are selected, each is searched with an equal share of {@code maxResults}
 * (plus one) and the merged passages are re-ranked. Passages below the similarity threshold are
 * dropped. Retrieval failures degrade to empty context unless the node is strict.</p>
 */
@Component
public class KnowledgeBaseNodeExecutor implements NodeExecutor {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseNodeExecutor.class);

    private final RetrievalClient retrievalClient;
    private final CollaboratorInvoker invoker;

    public KnowledgeBaseNodeExecutor(RetrievalClient retrievalClient, CollaboratorInvoker invoker) {
        this.retrievalClient = retrievalClient;
        this.invoker = invoker;
    }

    @Override
    public NodeType type() {
        return NodeType.KNOWLEDGE_BASE;
    }

    @Override
    public Set<String> requiredInputs() {
        return Set.of(Ports.QUERY);
    }

    @Override
    public Set<String> outputs() {
        return Set.of(Ports.CONTEXT, Ports.SOURCES);
    }

    @Override
    public Map<String, Object> execute(NodeExecution execution) {
        NodeConfig config = execution.config();
        String query = execution.inputs().getString(Ports.QUERY);
        int maxResults = config.getInt(NodeOptions.MAX_RESULTS, NodeOptions.DEFAULT_MAX_RESULTS);
        double threshold = config.getDouble(NodeOptions.SIMILARITY_THRESHOLD, NodeOptions.DEFAULT_SIMILARITY_THRESHOLD);
        boolean strict = config.getBoolean(NodeOptions.STRICT, false);
        List<String> documents = selectedDocuments(config);

        List<RetrievedPassage> passages;
        try {
            passages = retrieve(execution, query, documents, maxResults, threshold);
        } catch (CollaboratorException e) {
            if (strict) {
                throw e;
            }
            logger.warn("Retrieval failed, continuing without context nodeId={} kind={} error={}",
                    execution.nodeId(), e.getKind(), e.getMessage());
            return Map.of(Ports.CONTEXT, "", Ports.SOURCES, List.of());
        }

        List<RetrievedPassage> ranked = passages.stream()
                .filter(Objects::nonNull)
                .filter(passage -> passage.content() != null && !passage.content().isBlank())
                .filter(passage -> passage.score() >= threshold)
                .sorted(Comparator.comparingDouble(RetrievedPassage::score).reversed()
                        .thenComparing(passage -> passage.sourceId() == null ? "" : passage.sourceId()))
                .limit(maxResults)
                .toList();

        String context = String.join(NodeInputResolver.TEXT_SEPARATOR,
                ranked.stream().map(RetrievedPassage::content).toList());
        Set<String> sources = new LinkedHashSet<>();
        ranked.stream()
                .map(RetrievedPassage::sourceId)
                .filter(sourceId -> sourceId != null && !sourceId.isBlank())
                .forEach(sources::add);

        logger.info("Knowledge base retrieval completed nodeId={} documents={} passages={} contextLength={}",
                execution.nodeId(), documents.size(), ranked.size(), context.length());
        return Map.of(Ports.CONTEXT, context, Ports.SOURCES, List.copyOf(sources));
    }

    private List<RetrievedPassage> retrieve(NodeExecution execution, String query, List<String> documents,
                                            int maxResults, double threshold) {
        if (documents.isEmpty()) {
            return search(execution, query, null, maxResults, threshold);
        }
        int perDocument = (int) Math.min(Integer.MAX_VALUE, (long) maxResults / documents.size() + 1);
        List<RetrievedPassage> passages = new ArrayList<>();
        for (String documentId : documents) {
            passages.addAll(search(execution, query, documentId, perDocument, threshold));
        }
        return passages;
    }

    private List<RetrievedPassage> search(NodeExecution execution, String query, String documentId,
                                          int maxResults, double threshold) {
        List<RetrievedPassage> result = invoker.invoke(CollaboratorKind.RETRIEVAL, execution.context(),
                execution.nodeId(), () -> retrievalClient.search(query, documentId, maxResults, threshold));
        return result == null ? List.of() : result;
    }

    private static List<String> selectedDocuments(NodeConfig config) {
        Set<String> documents = new LinkedHashSet<>(config.getStringList(NodeOptions.SELECTED_DOCUMENTS));
        config.getString(NodeOptions.DOCUMENT_ID).ifPresent(documents::add);
        return List.copyOf(documents);
    }
}

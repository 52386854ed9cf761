package ai.genflow.workflow.graph.validation;

import ai.genflow.workflow.graph.exception.ConfigException;
import ai.genflow.workflow.graph.exception.CycleDetectedException;
import ai.genflow.workflow.graph.model.NodeConfig;
import ai.genflow.workflow.graph.model.NodeOptions;
import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowEdge;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;
import ai.genflow.workflow.graph.planning.ExecutionPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural and semantic checks a workflow graph must pass before execution.
 *
 * <p>Checks run in a fixed order. Structural defects (empty graph, duplicate ids,
 * dangling or self-referencing connections) and cycles end validation early;
 * missing node types are all reported together; connectivity and configuration
 * findings accumulate. A valid result carries the planned execution order.</p>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public class WorkflowGraphValidator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowGraphValidator.class);

    private static final List<NodeType> MANDATORY_TYPES = List.of(NodeType.USER_QUERY, NodeType.LLM_ENGINE, NodeType.OUTPUT);
    private static final Set<NodeType> SINGLETON_TYPES = Set.of(NodeType.USER_QUERY, NodeType.OUTPUT);

    private final String defaultModel;

    public WorkflowGraphValidator() {
        this(NodeOptions.DEFAULT_MODEL);
    }

    /**
     * @param defaultModel model the LLM engine falls back to; named in warnings
     */
    public WorkflowGraphValidator(String defaultModel) {
        this.defaultModel = defaultModel == null || defaultModel.isBlank() ? NodeOptions.DEFAULT_MODEL : defaultModel;
    }

    public ValidationResult validate(WorkflowGraph graph) {
        if (graph == null) {
            return ValidationResult.invalid(List.of("Workflow cannot be null"), List.of(), 0, 0);
        }
        int nodeCount = graph.nodeCount();
        int connectionCount = graph.edgeCount();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (graph.isEmpty()) {
            errors.add("Workflow must contain at least one node");
            return finish(ValidationResult.invalid(errors, warnings, nodeCount, connectionCount));
        }

        validateStructure(graph, errors);
        if (!errors.isEmpty()) {
            return finish(ValidationResult.invalid(errors, warnings, nodeCount, connectionCount));
        }

        validateNodeTypes(graph, errors);
        if (!errors.isEmpty()) {
            return finish(ValidationResult.invalid(errors, warnings, nodeCount, connectionCount));
        }

        List<String> executionOrder;
        try {
            executionOrder = ExecutionPlanner.plan(graph);
        } catch (CycleDetectedException e) {
            errors.addAll(e.getErrors());
            return finish(ValidationResult.cycle(errors, warnings, nodeCount, connectionCount, e.getOffendingNodes()));
        }

        validateConnectivity(graph, errors);
        validateConfiguration(graph, errors, warnings);

        if (!errors.isEmpty()) {
            return finish(ValidationResult.invalid(errors, warnings, nodeCount, connectionCount));
        }
        return finish(ValidationResult.valid(warnings, nodeCount, connectionCount, executionOrder));
    }

    private void validateStructure(WorkflowGraph graph, List<String> errors) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (WorkflowNode node : graph.nodes()) {
            if (!seen.add(node.id())) {
                duplicates.add(node.id());
            }
        }
        for (String duplicate : duplicates) {
            errors.add("Node id '" + duplicate + "' is used multiple times in the workflow");
        }

        for (WorkflowEdge edge : graph.edges()) {
            if (!seen.contains(edge.source())) {
                errors.add("Connection source '" + edge.source() + "' not found in nodes");
            }
            if (!seen.contains(edge.target())) {
                errors.add("Connection target '" + edge.target() + "' not found in nodes");
            }
            if (edge.isSelfLoop()) {
                errors.add("Node '" + edge.source() + "' cannot be connected to itself");
            }
        }
    }

    private void validateNodeTypes(WorkflowGraph graph, List<String> errors) {
        for (NodeType type : MANDATORY_TYPES) {
            if (!graph.hasNodeType(type)) {
                errors.add("Missing " + type.displayName() + " node");
            }
        }
        for (NodeType type : SINGLETON_TYPES) {
            int count = graph.nodesOfType(type).size();
            if (count > 1) {
                errors.add("Workflow must contain exactly one " + type.displayName() + " node but found " + count);
            }
        }
    }

    private void validateConnectivity(WorkflowGraph graph, List<String> errors) {
        for (WorkflowNode node : graph.nodes()) {
            if (node.type() != NodeType.USER_QUERY && graph.incomingEdges(node.id()).isEmpty()) {
                errors.add(node.describe() + " has no incoming connection");
            }
        }

        List<WorkflowNode> engines = graph.nodesOfType(NodeType.LLM_ENGINE);
        for (WorkflowNode output : graph.nodesOfType(NodeType.OUTPUT)) {
            boolean reachable = engines.stream().anyMatch(engine -> graph.isReachable(engine.id(), output.id()));
            if (!reachable) {
                errors.add(output.describe() + " is not reachable from an LLM Engine node");
            }
        }
    }

    private void validateConfiguration(WorkflowGraph graph, List<String> errors, List<String> warnings) {
        for (WorkflowNode node : graph.nodes()) {
            try {
                switch (node.type()) {
                    case KNOWLEDGE_BASE -> validateKnowledgeBase(node, errors);
                    case LLM_ENGINE -> validateLlmEngine(node, errors, warnings);
                    case OUTPUT -> node.config().getBoolean(NodeOptions.SHOW_SOURCES, NodeOptions.DEFAULT_SHOW_SOURCES);
                    case USER_QUERY -> {
                        // the request query replaces any design-time placeholder
                    }
                }
                node.config().getBoolean(NodeOptions.STRICT, false);
            } catch (ConfigException e) {
                errors.add(node.describe() + ": " + e.getMessage());
            }
        }
    }

    private void validateKnowledgeBase(WorkflowNode node, List<String> errors) {
        NodeConfig config = node.config();
        int maxResults = config.getInt(NodeOptions.MAX_RESULTS, NodeOptions.DEFAULT_MAX_RESULTS);
        if (maxResults < 1) {
            errors.add(node.describe() + ": maxResults must be at least 1");
        }
        double threshold = config.getDouble(NodeOptions.SIMILARITY_THRESHOLD, NodeOptions.DEFAULT_SIMILARITY_THRESHOLD);
        if (threshold < 0.0 || threshold > 1.0) {
            errors.add(node.describe() + ": similarityThreshold must be between 0 and 1");
        }
    }

    private void validateLlmEngine(WorkflowNode node, List<String> errors, List<String> warnings) {
        NodeConfig config = node.config();
        if (!config.has(NodeOptions.MODEL)) {
            warnings.add(node.describe() + " has no model configured; defaulting to " + defaultModel);
        }
        double temperature = config.getDouble(NodeOptions.TEMPERATURE, NodeOptions.DEFAULT_TEMPERATURE);
        if (temperature < 0.0 || temperature > 2.0) {
            errors.add(node.describe() + ": temperature must be between 0 and 2");
        }
        if (config.getInt(NodeOptions.MAX_TOKENS, NodeOptions.DEFAULT_MAX_TOKENS) < 1) {
            errors.add(node.describe() + ": maxTokens must be at least 1");
        }
        if (config.getBoolean(NodeOptions.ENABLE_WEB_SEARCH, false)
                && config.getInt(NodeOptions.WEB_SEARCH_RESULTS, NodeOptions.DEFAULT_WEB_SEARCH_RESULTS) < 1) {
            errors.add(node.describe() + ": webSearchResults must be at least 1");
        }
    }

    private static ValidationResult finish(ValidationResult result) {
        logger.debug("Workflow validation completed. Valid: {}, Errors: {}, Warnings: {}",
                result.valid(), result.errors().size(), result.warnings().size());
        return result;
    }
}

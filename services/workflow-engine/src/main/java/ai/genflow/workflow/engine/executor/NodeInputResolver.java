package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.engine.context.ContextBus;
import ai.genflow.workflow.graph.exception.ConfigException;
import ai.genflow.workflow.graph.model.WorkflowEdge;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves a node's declared inputs from the outputs its predecessors published.
 *
 * <p>An input port reads from every incoming connection that feeds it, in ascending source id
 * order. A connection with a target handle feeds only the port of that name and reads the source
 * handle's port when the producer published one, otherwise the port of the same name. A connection
 * without handles feeds each port the producer published under the same name. Several values for
 * one port are merged: text is joined with blank lines, lists are concatenated without duplicates.</p>
 *
 * <p>A required port left unresolved falls back to the only ancestor that published a port of
 * that name. Upstream ports are merged from all ancestors.</p>
 */
public final class NodeInputResolver {

    static final String TEXT_SEPARATOR = "\n\n";

    private NodeInputResolver() {
    }

    public static NodeInputs resolve(WorkflowGraph graph, WorkflowNode node, NodeExecutor executor, ContextBus bus) {
        List<WorkflowEdge> incoming = new ArrayList<>(graph.incomingEdges(node.id()));
        incoming.sort(Comparator.comparing(WorkflowEdge::source));

        Set<String> ancestors = graph.ancestors(node.id());
        Map<String, Object> values = new LinkedHashMap<>();

        for (String port : new TreeSet<>(executor.requiredInputs())) {
            Object value = fromConnections(incoming, port, bus);
            if (value == null) {
                value = fromUniqueAncestor(port, ancestors, bus).orElse(null);
            }
            if (value == null) {
                throw new ConfigException(node.id(),
                        node.describe() + " is missing required input '" + port + "'");
            }
            values.put(port, value);
        }
        for (String port : new TreeSet<>(executor.optionalInputs())) {
            Object value = fromConnections(incoming, port, bus);
            if (value != null) {
                values.put(port, value);
            }
        }
        for (String port : new TreeSet<>(executor.upstreamInputs())) {
            List<Object> collected = new ArrayList<>();
            for (String ancestor : ancestors) {
                bus.get(ancestor, port).ifPresent(collected::add);
            }
            Object value = merge(collected);
            if (value != null) {
                values.put(port, value);
            }
        }
        return NodeInputs.of(values);
    }

    private static Object fromConnections(List<WorkflowEdge> incoming, String port, ContextBus bus) {
        List<Object> collected = new ArrayList<>();
        for (WorkflowEdge edge : incoming) {
            String producerPort = producerPort(edge, port, bus);
            if (producerPort != null) {
                bus.get(edge.source(), producerPort).ifPresent(collected::add);
            }
        }
        return merge(collected);
    }

    private static String producerPort(WorkflowEdge edge, String port, ContextBus bus) {
        if (edge.targetHandle() != null && !edge.targetHandle().equals(port)) {
            return null;
        }
        String sourceHandle = edge.sourceHandle();
        if (sourceHandle != null && bus.contains(edge.source(), sourceHandle)) {
            if (edge.targetHandle() != null) {
                return sourceHandle;
            }
            return sourceHandle.equals(port) ? port : null;
        }
        return port;
    }

    private static Optional<Object> fromUniqueAncestor(String port, Set<String> ancestors, ContextBus bus) {
        return bus.uniqueProducer(port)
                .filter(ancestors::contains)
                .flatMap(producer -> bus.get(producer, port));
    }

    static Object merge(List<Object> values) {
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() == 1) {
            return values.get(0);
        }
        if (values.stream().allMatch(value -> value instanceof List<?>)) {
            Set<Object> merged = new LinkedHashSet<>();
            values.forEach(value -> merged.addAll((List<?>) value));
            return List.copyOf(merged);
        }
        if (values.stream().allMatch(value -> value instanceof String)) {
            List<String> parts = new ArrayList<>();
            for (Object value : values) {
                if (!((String) value).isBlank()) {
                    parts.add((String) value);
                }
            }
            return String.join(TEXT_SEPARATOR, parts);
        }
        return values.get(0);
    }
}

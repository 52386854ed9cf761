package ai.genflow.workflow.graph.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of a user-authored workflow: its nodes and connections at
 * the moment of submission.
 *
 * @param nodes nodes in editor order
 * @param edges directed connections
 */
public record WorkflowGraph(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {

    public WorkflowGraph {
        if (nodes == null) {
            throw new IllegalArgumentException("Nodes cannot be null");
        }
        if (edges == null) {
            throw new IllegalArgumentException("Edges cannot be null");
        }
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static WorkflowGraph of(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
        return new WorkflowGraph(nodes, edges);
    }

    public static WorkflowGraph empty() {
        return new WorkflowGraph(List.of(), List.of());
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        for (WorkflowNode node : nodes) {
            if (node.id().equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public boolean containsNode(String nodeId) {
        return getNode(nodeId).isPresent();
    }

    public List<WorkflowNode> nodesOfType(NodeType type) {
        List<WorkflowNode> matching = new ArrayList<>();
        for (WorkflowNode node : nodes) {
            if (node.type() == type) {
                matching.add(node);
            }
        }
        return List.copyOf(matching);
    }

    public boolean hasNodeType(NodeType type) {
        return nodes.stream().anyMatch(node -> node.type() == type);
    }

    public List<WorkflowEdge> incomingEdges(String nodeId) {
        return edges.stream().filter(edge -> edge.target().equals(nodeId)).toList();
    }

    public List<WorkflowEdge> outgoingEdges(String nodeId) {
        return edges.stream().filter(edge -> edge.source().equals(nodeId)).toList();
    }

    /**
     * Direct predecessors, sorted by id.
     */
    public Set<String> predecessors(String nodeId) {
        TreeSet<String> predecessors = new TreeSet<>();
        for (WorkflowEdge edge : edges) {
            if (edge.target().equals(nodeId)) {
                predecessors.add(edge.source());
            }
        }
        return predecessors;
    }

    /**
     * All nodes from which {@code nodeId} can be reached, sorted by id.
     */
    public Set<String> ancestors(String nodeId) {
        TreeSet<String> visited = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(predecessors(nodeId));
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (visited.add(current)) {
                pending.addAll(predecessors(current));
            }
        }
        visited.remove(nodeId);
        return visited;
    }

    /**
     * Whether {@code targetId} can be reached from {@code sourceId} by following edges.
     */
    public boolean isReachable(String sourceId, String targetId) {
        return ancestors(targetId).contains(sourceId);
    }

    public List<String> nodeIds() {
        return nodes.stream().map(WorkflowNode::id).toList();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }
}

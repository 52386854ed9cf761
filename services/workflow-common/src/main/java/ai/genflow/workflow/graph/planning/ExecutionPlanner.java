package ai.genflow.workflow.graph.planning;

import ai.genflow.workflow.graph.exception.CycleDetectedException;
import ai.genflow.workflow.graph.model.WorkflowEdge;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives a deterministic execution order for a workflow graph.
 *
 * <p>Kahn's algorithm; whenever several nodes become ready at once the
 * lexicographically smallest id runs first, so identical graphs always yield
 * identical orders.</p>
 */
public final class ExecutionPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionPlanner.class);

    private ExecutionPlanner() {
    }

    /**
     * Computes the execution order.
     *
     * @param graph the graph snapshot; edges naming unknown nodes are ignored
     * @return node ids, every edge source before its target
     * @throws CycleDetectedException if the graph contains a cycle
     */
    public static List<String> plan(WorkflowGraph graph) {
        Map<String, List<String>> successors = new TreeMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (WorkflowNode node : graph.nodes()) {
            successors.putIfAbsent(node.id(), new ArrayList<>());
            inDegree.putIfAbsent(node.id(), 0);
        }
        for (WorkflowEdge edge : graph.edges()) {
            if (!successors.containsKey(edge.source()) || !successors.containsKey(edge.target())) {
                continue;
            }
            successors.get(edge.source()).add(edge.target());
            inDegree.merge(edge.target(), 1, Integer::sum);
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((nodeId, degree) -> {
            if (degree == 0) {
                ready.add(nodeId);
            }
        });

        List<String> order = new ArrayList<>(successors.size());
        while (!ready.isEmpty()) {
            String nodeId = ready.poll();
            order.add(nodeId);
            for (String successor : successors.get(nodeId)) {
                if (inDegree.merge(successor, -1, Integer::sum) == 0) {
                    ready.add(successor);
                }
            }
        }

        if (order.size() != successors.size()) {
            Set<String> remaining = new HashSet<>(successors.keySet());
            order.forEach(remaining::remove);
            Set<String> onCycle = nodesOnCycles(remaining, successors);
            logger.debug("Cycle detected; unscheduled={} onCycle={}", remaining, onCycle);
            throw new CycleDetectedException(onCycle.isEmpty() ? remaining : onCycle);
        }
        return List.copyOf(order);
    }

    /**
     * Groups an execution order into dependency stages. Nodes within one stage have
     * no ancestor relationship and may run concurrently; stages keep plan order.
     *
     * @param graph the graph snapshot
     * @param order an order previously returned by {@link #plan(WorkflowGraph)}
     * @return stages, each listing node ids in plan order
     */
    public static List<List<String>> stages(WorkflowGraph graph, List<String> order) {
        Map<String, Integer> depth = new HashMap<>();
        Map<Integer, List<String>> byDepth = new LinkedHashMap<>();
        for (String nodeId : order) {
            int level = 0;
            for (String predecessor : graph.predecessors(nodeId)) {
                Integer predecessorLevel = depth.get(predecessor);
                if (predecessorLevel != null) {
                    level = Math.max(level, predecessorLevel + 1);
                }
            }
            depth.put(nodeId, level);
            byDepth.computeIfAbsent(level, ignored -> new ArrayList<>()).add(nodeId);
        }
        List<List<String>> stages = new ArrayList<>(byDepth.size());
        for (int level = 0; level < byDepth.size(); level++) {
            stages.add(List.copyOf(byDepth.get(level)));
        }
        return List.copyOf(stages);
    }

    private static Set<String> nodesOnCycles(Set<String> remaining, Map<String, List<String>> successors) {
        Set<String> onCycle = new TreeSet<>();
        for (String start : remaining) {
            Deque<String> pending = new ArrayDeque<>(successors.get(start));
            Set<String> visited = new HashSet<>();
            while (!pending.isEmpty()) {
                String current = pending.pop();
                if (current.equals(start)) {
                    onCycle.add(start);
                    break;
                }
                if (remaining.contains(current) && visited.add(current)) {
                    pending.addAll(successors.get(current));
                }
            }
        }
        return onCycle;
    }
}

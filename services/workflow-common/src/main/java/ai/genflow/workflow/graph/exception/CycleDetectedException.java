package ai.genflow.workflow.graph.exception;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Raised by the planner when no execution order exists.
 */
public class CycleDetectedException extends GraphValidationException {

    private final Set<String> offendingNodes;

    public CycleDetectedException(Set<String> offendingNodes) {
        super(ErrorKind.CYCLE_DETECTED, List.of(describe(offendingNodes)));
        this.offendingNodes = Set.copyOf(offendingNodes);
    }

    /**
     * @return the nodes left unscheduled, sorted by id
     */
    public Set<String> getOffendingNodes() {
        return new TreeSet<>(offendingNodes);
    }

    static String describe(Set<String> offendingNodes) {
        return "Workflow contains circular dependencies between nodes " + new TreeSet<>(offendingNodes);
    }
}

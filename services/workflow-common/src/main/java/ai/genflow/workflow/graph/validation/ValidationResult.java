package ai.genflow.workflow.graph.validation;

import java.util.List;
import java.util.Set;

/**
 * Verdict of validating a workflow graph.
 *
 * @param valid whether the graph may be executed
 * @param errors human-readable reasons, empty iff {@code valid}
 * @param warnings non-fatal findings, for example options that fall back to defaults
 * @param nodeCount number of nodes submitted
 * @param connectionCount number of connections submitted
 * @param executionOrder planned order; empty unless {@code valid}
 * @param cycleNodes nodes on a dependency cycle, empty unless a cycle was found
 */
public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        int nodeCount,
        int connectionCount,
        List<String> executionOrder,
        Set<String> cycleNodes
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        executionOrder = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        cycleNodes = cycleNodes == null ? Set.of() : Set.copyOf(cycleNodes);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("A valid result cannot carry errors");
        }
        if (!valid && errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result must carry at least one error");
        }
    }

    public static ValidationResult valid(List<String> warnings, int nodeCount, int connectionCount,
                                         List<String> executionOrder) {
        return new ValidationResult(true, List.of(), warnings, nodeCount, connectionCount, executionOrder, Set.of());
    }

    public static ValidationResult invalid(List<String> errors, List<String> warnings, int nodeCount,
                                           int connectionCount) {
        return new ValidationResult(false, errors, warnings, nodeCount, connectionCount, List.of(), Set.of());
    }

    public static ValidationResult cycle(List<String> errors, List<String> warnings, int nodeCount,
                                         int connectionCount, Set<String> cycleNodes) {
        return new ValidationResult(false, errors, warnings, nodeCount, connectionCount, List.of(), cycleNodes);
    }

    public boolean hasCycle() {
        return !cycleNodes.isEmpty();
    }
}

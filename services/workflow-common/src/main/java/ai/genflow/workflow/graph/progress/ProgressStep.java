package ai.genflow.workflow.graph.progress;

/**
 * One client-visible progress step.
 *
 * @param title short step title
 * @param description one-line explanation
 */
public record ProgressStep(String title, String description) {
}

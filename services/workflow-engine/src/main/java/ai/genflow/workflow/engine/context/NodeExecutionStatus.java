package ai.genflow.workflow.engine.context;

public enum NodeExecutionStatus {
    COMPLETED,
    FAILED
}

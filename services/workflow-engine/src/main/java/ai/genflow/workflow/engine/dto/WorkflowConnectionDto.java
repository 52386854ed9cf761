package ai.genflow.workflow.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Directed connection between two nodes, optionally naming the ports it joins.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowConnectionDto {

    private String source;

    private String target;

    private String sourceHandle;

    private String targetHandle;

    public WorkflowConnectionDto() {
    }

    public WorkflowConnectionDto(String source, String target) {
        this(source, target, null, null);
    }

    public WorkflowConnectionDto(String source, String target, String sourceHandle, String targetHandle) {
        this.source = source;
        this.target = target;
        this.sourceHandle = sourceHandle;
        this.targetHandle = targetHandle;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    public void setSourceHandle(String sourceHandle) {
        this.sourceHandle = sourceHandle;
    }

    public String getTargetHandle() {
        return targetHandle;
    }

    public void setTargetHandle(String targetHandle) {
        this.targetHandle = targetHandle;
    }
}

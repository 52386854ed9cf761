package ai.genflow.workflow.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ExecutionLogEntryDto {

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("node_type")
    private String nodeType;

    private String status;

    @JsonProperty("duration_ms")
    private long durationMs;

    @JsonProperty("collaborator_ms")
    private long collaboratorMs;

    public ExecutionLogEntryDto() {
    }

    public ExecutionLogEntryDto(String nodeId, String nodeType, String status, long durationMs, long collaboratorMs) {
        this.nodeId = nodeId;
        this.nodeType = nodeType;
        this.status = status;
        this.durationMs = durationMs;
        this.collaboratorMs = collaboratorMs;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public String getNodeType() {
        return nodeType;
    }

    public void setNodeType(String nodeType) {
        this.nodeType = nodeType;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public long getCollaboratorMs() {
        return collaboratorMs;
    }

    public void setCollaboratorMs(long collaboratorMs) {
        this.collaboratorMs = collaboratorMs;
    }
}

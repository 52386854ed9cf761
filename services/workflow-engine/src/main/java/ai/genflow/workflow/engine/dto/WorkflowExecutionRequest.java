package ai.genflow.workflow.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowExecutionRequest {

    @NotBlank(message = "Query cannot be blank")
    @Size(max = 10000, message = "Query must not exceed 10000 characters")
    private String query;

    @JsonProperty("user_id")
    @Size(max = 255, message = "User id must not exceed 255 characters")
    private String userId;

    @JsonProperty("run_id")
    @Size(max = 128, message = "Run id must not exceed 128 characters")
    private String runId;

    @Valid
    @NotNull(message = "Workflow cannot be null")
    private WorkflowDefinitionDto workflow;

    public WorkflowExecutionRequest() {
    }

    public WorkflowExecutionRequest(String query, String userId, WorkflowDefinitionDto workflow) {
        this.query = query;
        this.userId = userId;
        this.workflow = workflow;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public WorkflowDefinitionDto getWorkflow() {
        return workflow;
    }

    public void setWorkflow(WorkflowDefinitionDto workflow) {
        this.workflow = workflow;
    }
}

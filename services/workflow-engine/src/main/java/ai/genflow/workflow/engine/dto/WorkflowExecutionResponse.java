package ai.genflow.workflow.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class WorkflowExecutionResponse {

    @JsonProperty("run_id")
    private String runId;

    private String response;

    private List<String> sources = new ArrayList<>();

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    @JsonProperty("execution_log")
    private List<ExecutionLogEntryDto> executionLog = new ArrayList<>();

    public WorkflowExecutionResponse() {
    }

    public WorkflowExecutionResponse(String runId, String response, List<String> sources, long executionTimeMs,
                                     List<ExecutionLogEntryDto> executionLog) {
        this.runId = runId;
        this.response = response;
        this.sources = sources;
        this.executionTimeMs = executionTimeMs;
        this.executionLog = executionLog;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getResponse() {
        return response;
    }

    public void setResponse(String response) {
        this.response = response;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public List<ExecutionLogEntryDto> getExecutionLog() {
        return executionLog;
    }

    public void setExecutionLog(List<ExecutionLogEntryDto> executionLog) {
        this.executionLog = executionLog;
    }
}

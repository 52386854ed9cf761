package ai.genflow.workflow.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation verdict. {@code error} summarizes {@code errors} and is omitted for valid workflows.
 */
public class ValidationResponse {

    private boolean valid;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;

    private List<String> errors = new ArrayList<>();

    private List<String> warnings = new ArrayList<>();

    @JsonProperty("node_count")
    private int nodeCount;

    @JsonProperty("connection_count")
    private int connectionCount;

    @JsonProperty("execution_order")
    private List<String> executionOrder = new ArrayList<>();

    public ValidationResponse() {
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<String> warnings) {
        this.warnings = warnings;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public void setNodeCount(int nodeCount) {
        this.nodeCount = nodeCount;
    }

    public int getConnectionCount() {
        return connectionCount;
    }

    public void setConnectionCount(int connectionCount) {
        this.connectionCount = connectionCount;
    }

    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    public void setExecutionOrder(List<String> executionOrder) {
        this.executionOrder = executionOrder;
    }
}

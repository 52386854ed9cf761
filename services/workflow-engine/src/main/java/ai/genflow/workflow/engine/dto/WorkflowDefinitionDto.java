package ai.genflow.workflow.engine.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowDefinitionDto {

    private List<WorkflowNodeDto> nodes = new ArrayList<>();

    @JsonAlias("edges")
    private List<WorkflowConnectionDto> connections = new ArrayList<>();

    public WorkflowDefinitionDto() {
    }

    public WorkflowDefinitionDto(List<WorkflowNodeDto> nodes, List<WorkflowConnectionDto> connections) {
        this.nodes = nodes;
        this.connections = connections;
    }

    public List<WorkflowNodeDto> getNodes() {
        return nodes;
    }

    public void setNodes(List<WorkflowNodeDto> nodes) {
        this.nodes = nodes;
    }

    public List<WorkflowConnectionDto> getConnections() {
        return connections;
    }

    public void setConnections(List<WorkflowConnectionDto> connections) {
        this.connections = connections;
    }
}

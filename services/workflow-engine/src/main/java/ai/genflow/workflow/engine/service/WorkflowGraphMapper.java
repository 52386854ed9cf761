package ai.genflow.workflow.engine.service;

import ai.genflow.workflow.engine.context.NodeExecutionRecord;
import ai.genflow.workflow.engine.dto.ErrorResponse;
import ai.genflow.workflow.engine.dto.ExecutionLogEntryDto;
import ai.genflow.workflow.engine.dto.ValidationResponse;
import ai.genflow.workflow.engine.dto.WorkflowConnectionDto;
import ai.genflow.workflow.engine.dto.WorkflowDefinitionDto;
import ai.genflow.workflow.engine.dto.WorkflowExecutionResponse;
import ai.genflow.workflow.engine.dto.WorkflowNodeDto;
import ai.genflow.workflow.graph.exception.GraphValidationException;
import ai.genflow.workflow.graph.model.NodeConfig;
import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowEdge;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;
import ai.genflow.workflow.graph.validation.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between the editor's wire format and the graph model.
 */
@Component
public class WorkflowGraphMapper {

    /**
     * @throws GraphValidationException listing every node or connection that cannot be represented,
     *         such as unknown node types or connections without endpoints
     */
    public WorkflowGraph toGraph(WorkflowDefinitionDto definition) {
        if (definition == null) {
            throw new GraphValidationException(List.of("Workflow cannot be null"));
        }
        List<String> errors = new ArrayList<>();
        List<WorkflowNode> nodes = new ArrayList<>();
        List<WorkflowEdge> edges = new ArrayList<>();

        List<WorkflowNodeDto> nodeDtos = definition.getNodes() == null ? List.of() : definition.getNodes();
        for (int i = 0; i < nodeDtos.size(); i++) {
            WorkflowNodeDto dto = nodeDtos.get(i);
            if (dto == null || dto.getId() == null || dto.getId().isBlank()) {
                errors.add("Node at index " + i + " has no id");
                continue;
            }
            Optional<NodeType> type = NodeType.fromWireName(dto.getType());
            if (type.isEmpty()) {
                errors.add("Node '" + dto.getId() + "' has unknown type '" + dto.getType() + "'");
                continue;
            }
            nodes.add(new WorkflowNode(dto.getId().trim(), type.get(), NodeConfig.of(extractConfig(dto))));
        }

        List<WorkflowConnectionDto> connectionDtos =
                definition.getConnections() == null ? List.of() : definition.getConnections();
        for (int i = 0; i < connectionDtos.size(); i++) {
            WorkflowConnectionDto dto = connectionDtos.get(i);
            if (dto == null || isBlank(dto.getSource()) || isBlank(dto.getTarget())) {
                errors.add("Connection at index " + i + " must name both a source and a target");
                continue;
            }
            edges.add(new WorkflowEdge(dto.getSource().trim(), dto.getTarget().trim(),
                    dto.getSourceHandle(), dto.getTargetHandle()));
        }

        if (!errors.isEmpty()) {
            throw new GraphValidationException(errors);
        }
        return WorkflowGraph.of(nodes, edges);
    }

    public ValidationResponse toValidationResponse(ValidationResult result) {
        ValidationResponse response = new ValidationResponse();
        response.setValid(result.valid());
        response.setError(result.valid() ? null : String.join("; ", result.errors()));
        response.setErrors(result.errors());
        response.setWarnings(result.warnings());
        response.setNodeCount(result.nodeCount());
        response.setConnectionCount(result.connectionCount());
        response.setExecutionOrder(result.executionOrder());
        return response;
    }

    /**
     * Reports a workflow that could not be mapped in the same shape as a failed validation.
     */
    public ValidationResponse toValidationResponse(GraphValidationException exception, WorkflowDefinitionDto definition) {
        ValidationResponse response = new ValidationResponse();
        response.setValid(false);
        response.setError(String.join("; ", exception.getErrors()));
        response.setErrors(exception.getErrors());
        response.setNodeCount(definition == null || definition.getNodes() == null ? 0 : definition.getNodes().size());
        response.setConnectionCount(definition == null || definition.getConnections() == null
                ? 0 : definition.getConnections().size());
        return response;
    }

    public WorkflowExecutionResponse toExecutionResponse(ExecutionResult result) {
        return new WorkflowExecutionResponse(result.runId(), result.response(), result.sources(),
                result.executionTimeMs(), toLogEntries(result.executionLog()));
    }

    public ErrorResponse toErrorResponse(ExecutionResult result) {
        ExecutionFailure failure = result.failure();
        return new ErrorResponse(failure.kind().name(), failure.nodeId(), failure.message(), failure.errors(),
                result.runId());
    }

    private static List<ExecutionLogEntryDto> toLogEntries(List<NodeExecutionRecord> records) {
        return records.stream()
                .map(record -> new ExecutionLogEntryDto(record.nodeId(), record.nodeType().wireName(),
                        record.status().name(), record.durationMs(), record.collaboratorMs()))
                .toList();
    }

    private static Map<String, Object> extractConfig(WorkflowNodeDto dto) {
        Map<String, Object> config = new LinkedHashMap<>();
        if (dto.getConfig() != null) {
            config.putAll(dto.getConfig());
        }
        if (dto.getData() != null && dto.getData().get("config") instanceof Map<?, ?> nested) {
            nested.forEach((key, value) -> {
                if (key != null) {
                    config.put(key.toString(), value);
                }
            });
        }
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package ai.genflow.workflow.engine.controller;

import ai.genflow.workflow.engine.context.CancellationToken;
import ai.genflow.workflow.engine.dto.ValidationResponse;
import ai.genflow.workflow.engine.dto.WorkflowDefinitionDto;
import ai.genflow.workflow.engine.dto.WorkflowExecutionRequest;
import ai.genflow.workflow.engine.service.ExecutionRequest;
import ai.genflow.workflow.engine.service.ExecutionResult;
import ai.genflow.workflow.engine.service.WorkflowGraphMapper;
import ai.genflow.workflow.engine.service.WorkflowOrchestrator;
import ai.genflow.workflow.engine.service.WorkflowRunRegistry;
import ai.genflow.workflow.graph.exception.GraphValidationException;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.progress.ProgressReporter;
import ai.genflow.workflow.graph.progress.ProgressStep;
import ai.genflow.workflow.graph.validation.ValidationResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Workflow validation and execution APIs used by the editor and chat clients.
 */
@RestController
@RequestMapping("/workflow")
@CrossOrigin(origins = "*", maxAge = 3600)
public class WorkflowController {

    private final WorkflowOrchestrator orchestrator;
    private final WorkflowGraphMapper mapper;
    private final WorkflowRunRegistry runRegistry;

    public WorkflowController(WorkflowOrchestrator orchestrator, WorkflowGraphMapper mapper,
                              WorkflowRunRegistry runRegistry) {
        this.orchestrator = orchestrator;
        this.mapper = mapper;
        this.runRegistry = runRegistry;
    }

    /**
     * Validate a workflow without executing it. Always answers 200; the verdict is in the body.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@RequestBody WorkflowDefinitionDto workflow) {
        WorkflowGraph graph;
        try {
            graph = mapper.toGraph(workflow);
        } catch (GraphValidationException e) {
            return ResponseEntity.ok(mapper.toValidationResponse(e, workflow));
        }
        ValidationResult result = orchestrator.validate(graph);
        return ResponseEntity.ok(mapper.toValidationResponse(result));
    }

    /**
     * Execute a workflow for one query.
     *
     * @return the response and sorted citations, or an error body whose status reflects the failure kind
     */
    @PostMapping("/execute")
    public ResponseEntity<?> execute(@Valid @RequestBody WorkflowExecutionRequest request) {
        WorkflowGraph graph = mapper.toGraph(request.getWorkflow());
        ExecutionRequest execution = new ExecutionRequest(request.getRunId(), request.getUserId(), request.getQuery());

        CancellationToken cancellation;
        try {
            cancellation = runRegistry.register(execution.runId());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }

        ExecutionResult result;
        try {
            result = orchestrator.execute(graph, execution, cancellation);
        } finally {
            runRegistry.release(execution.runId());
        }

        if (result.succeeded()) {
            return ResponseEntity.ok(mapper.toExecutionResponse(result));
        }
        return ResponseEntity.status(WorkflowExceptionHandler.statusFor(result.failure().kind()))
                .body(mapper.toErrorResponse(result));
    }

    /**
     * Cancel an in-flight run. The run stops before its next node starts.
     */
    @PostMapping("/executions/{runId}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String runId) {
        if (!runRegistry.cancel(runId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No run in progress with id " + runId);
        }
        return ResponseEntity.accepted().build();
    }

    /**
     * Progress steps a client can display while the workflow runs.
     */
    @PostMapping("/progress")
    public ResponseEntity<List<ProgressStep>> progress(@RequestBody WorkflowDefinitionDto workflow) {
        return ResponseEntity.ok(ProgressReporter.describe(mapper.toGraph(workflow)));
    }
}

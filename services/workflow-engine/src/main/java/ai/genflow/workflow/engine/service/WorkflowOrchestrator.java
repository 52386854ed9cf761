package ai.genflow.workflow.engine.service;

import ai.genflow.workflow.engine.collaborator.HistoryMessage;
import ai.genflow.workflow.engine.collaborator.HistoryStore;
import ai.genflow.workflow.engine.config.EngineProperties;
import ai.genflow.workflow.engine.context.CancellationToken;
import ai.genflow.workflow.engine.context.ExecutionContext;
import ai.genflow.workflow.engine.context.NodeExecutionRecord;
import ai.genflow.workflow.engine.context.NodeExecutionStatus;
import ai.genflow.workflow.engine.executor.FinalOutput;
import ai.genflow.workflow.engine.executor.NodeExecution;
import ai.genflow.workflow.engine.executor.NodeExecutor;
import ai.genflow.workflow.engine.executor.NodeExecutorRegistry;
import ai.genflow.workflow.engine.executor.NodeInputResolver;
import ai.genflow.workflow.engine.executor.NodeInputs;
import ai.genflow.workflow.engine.executor.Ports;
import ai.genflow.workflow.graph.exception.ConfigException;
import ai.genflow.workflow.graph.exception.ExecutionCancelledException;
import ai.genflow.workflow.graph.exception.NodeExecutionException;
import ai.genflow.workflow.graph.exception.WorkflowException;
import ai.genflow.workflow.graph.model.NodeType;
import ai.genflow.workflow.graph.model.WorkflowGraph;
import ai.genflow.workflow.graph.model.WorkflowNode;
import ai.genflow.workflow.graph.planning.ExecutionPlanner;
import ai.genflow.workflow.graph.validation.ValidationResult;
import ai.genflow.workflow.graph.validation.WorkflowGraphValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a workflow graph for one query.
 *
 * <p>A run validates and plans the graph, then executes nodes in plan order. Each node reads its
 * inputs from the outputs of nodes that already ran. The first failing node ends the run and the
 * failure is returned classified; partial outputs are discarded. Cancellation is honoured between
 * nodes.</p>
 *
 * <p>With {@code genflow.engine.parallel-branches} enabled, nodes of the same dependency stage run
 * concurrently, but their outputs, log entries and listener callbacks are committed in plan order,
 * so results match a sequential run.</p>
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    private final WorkflowGraphValidator validator;
    private final NodeExecutorRegistry executors;
    private final EngineProperties properties;
    private final List<WorkflowRunListener> listeners;
    private final HistoryStore historyStore;
    private final ExecutorService branchExecutor;
    private final ExecutorService historyExecutor;

    public WorkflowOrchestrator(WorkflowGraphValidator validator,
                                NodeExecutorRegistry executors,
                                EngineProperties properties,
                                List<WorkflowRunListener> listeners,
                                HistoryStore historyStore,
                                @Qualifier("branchExecutor") ExecutorService branchExecutor,
                                @Qualifier("historyExecutor") ExecutorService historyExecutor) {
        this.validator = validator;
        this.executors = executors;
        this.properties = properties;
        this.listeners = List.copyOf(listeners);
        this.historyStore = historyStore;
        this.branchExecutor = branchExecutor;
        this.historyExecutor = historyExecutor;
    }

    public ValidationResult validate(WorkflowGraph graph) {
        return validator.validate(graph);
    }

    public ExecutionResult execute(WorkflowGraph graph, ExecutionRequest request) {
        return execute(graph, request, CancellationToken.none());
    }

    public ExecutionResult execute(WorkflowGraph graph, ExecutionRequest request, CancellationToken cancellation) {
        ExecutionContext context = new ExecutionContext(request.runId(), request.userId(), request.query(),
                cancellation);

        ValidationResult validation = validator.validate(graph);
        if (!validation.valid()) {
            return finish(context, ExecutionResult.failed(context.getRunId(),
                    ExecutionFailure.fromValidation(validation), 0, List.of()));
        }

        List<String> order = validation.executionOrder();
        logger.info("Starting run runId={} nodes={} connections={} parallelBranches={}",
                context.getRunId(), graph.nodeCount(), graph.edgeCount(), properties.isParallelBranches());
        try {
            if (properties.isParallelBranches()) {
                runStaged(graph, order, context);
            } else {
                runSequential(graph, order, context);
            }
        } catch (NodeRunFailure failure) {
            return finish(context, ExecutionResult.failed(context.getRunId(),
                    ExecutionFailure.from(failure.failure(), failure.nodeId()),
                    context.executionTimeMs(), context.getRecords()));
        }

        WorkflowNode outputNode = graph.nodesOfType(NodeType.OUTPUT).get(0);
        Object produced = context.getBus().get(outputNode.id(), Ports.RESULT).orElse(null);
        if (!(produced instanceof FinalOutput output)) {
            NodeExecutionException missing = new NodeExecutionException(outputNode.id(),
                    outputNode.describe() + " completed without a result", null);
            return finish(context, ExecutionResult.failed(context.getRunId(),
                    ExecutionFailure.from(missing, outputNode.id()), context.executionTimeMs(), context.getRecords()));
        }

        ExecutionResult result = ExecutionResult.succeeded(context.getRunId(), output.response(), output.sources(),
                context.executionTimeMs(), context.getRecords());
        appendHistory(context, result);
        return finish(context, result);
    }

    private void runSequential(WorkflowGraph graph, List<String> order, ExecutionContext context) {
        for (String nodeId : order) {
            checkCancelled(context, nodeId);
            WorkflowNode node = requireNode(graph, nodeId);
            listeners.forEach(listener -> listener.onNodeStarted(context, node));
            commit(runNode(graph, node, context), context);
        }
    }

    private void runStaged(WorkflowGraph graph, List<String> order, ExecutionContext context) {
        for (List<String> stage : ExecutionPlanner.stages(graph, order)) {
            checkCancelled(context, stage.get(0));
            List<WorkflowNode> nodes = stage.stream().map(nodeId -> requireNode(graph, nodeId)).toList();
            nodes.forEach(node -> listeners.forEach(listener -> listener.onNodeStarted(context, node)));

            List<NodeOutcome> outcomes = new ArrayList<>();
            if (nodes.size() == 1) {
                outcomes.add(runNode(graph, nodes.get(0), context));
            } else {
                List<CompletableFuture<NodeOutcome>> futures = nodes.stream()
                        .map(node -> CompletableFuture.supplyAsync(() -> runNode(graph, node, context), branchExecutor))
                        .toList();
                for (CompletableFuture<NodeOutcome> future : futures) {
                    outcomes.add(join(future));
                }
            }
            for (NodeOutcome outcome : outcomes) {
                commit(outcome, context);
            }
        }
    }

    /**
     * Executes one node without touching shared run state other than reading the bus.
     */
    private NodeOutcome runNode(WorkflowGraph graph, WorkflowNode node, ExecutionContext context) {
        NodeExecutor executor;
        NodeInputs inputs;
        try {
            executor = executors.get(node.type());
            inputs = NodeInputResolver.resolve(graph, node, executor, context.getBus());
        } catch (WorkflowException e) {
            return NodeOutcome.failed(node, 0L, e);
        } catch (RuntimeException e) {
            return NodeOutcome.failed(node, 0L, unexpectedFailure(context, node, e));
        }

        long started = System.nanoTime();
        try {
            Map<String, Object> outputs = executor.execute(new NodeExecution(node, inputs, context));
            long elapsed = System.nanoTime() - started;
            List<String> missing = executor.outputs().stream()
                    .filter(port -> outputs == null || !outputs.containsKey(port))
                    .sorted()
                    .toList();
            if (!missing.isEmpty()) {
                return NodeOutcome.failed(node, elapsed, new ConfigException(node.id(),
                        node.describe() + " did not produce outputs " + missing));
            }
            return NodeOutcome.completed(node, elapsed, outputs);
        } catch (WorkflowException e) {
            return NodeOutcome.failed(node, System.nanoTime() - started, e);
        } catch (RuntimeException e) {
            return NodeOutcome.failed(node, System.nanoTime() - started, unexpectedFailure(context, node, e));
        }
    }

    private static NodeExecutionException unexpectedFailure(ExecutionContext context, WorkflowNode node,
                                                            RuntimeException e) {
        logger.error("Node failed unexpectedly runId={} nodeId={} type={}", context.getRunId(), node.id(),
                node.type(), e);
        String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new NodeExecutionException(node.id(), node.describe() + " failed unexpectedly: " + detail, e);
    }

    private void commit(NodeOutcome outcome, ExecutionContext context) {
        WorkflowNode node = outcome.node();
        if (outcome.failure() != null) {
            NodeExecutionRecord record = context.recordNode(node.id(), node.type(), NodeExecutionStatus.FAILED,
                    outcome.nanos());
            listeners.forEach(listener -> listener.onNodeFailed(context, node, record, outcome.failure()));
            throw new NodeRunFailure(node.id(), outcome.failure());
        }
        context.getBus().publish(node.id(), outcome.outputs());
        NodeExecutionRecord record = context.recordNode(node.id(), node.type(), NodeExecutionStatus.COMPLETED,
                outcome.nanos());
        listeners.forEach(listener -> listener.onNodeCompleted(context, node, record));
    }

    private static void checkCancelled(ExecutionContext context, String nextNodeId) {
        if (context.getCancellation().isCancelled()) {
            throw new NodeRunFailure(nextNodeId, new ExecutionCancelledException(context.getRunId(), nextNodeId));
        }
    }

    private static NodeOutcome join(CompletableFuture<NodeOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static WorkflowNode requireNode(WorkflowGraph graph, String nodeId) {
        return graph.getNode(nodeId)
                .orElseThrow(() -> new IllegalStateException("Planned node '" + nodeId + "' is not in the graph"));
    }

    private void appendHistory(ExecutionContext context, ExecutionResult result) {
        String userId = context.getUserId();
        if (userId == null || userId.isBlank()) {
            return;
        }
        HistoryMessage message = new HistoryMessage(context.getQuery(), result.response(), result.sources(),
                Instant.now());
        try {
            CompletableFuture.runAsync(() -> historyStore.append(userId, message), historyExecutor)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            logger.warn("Failed to record history runId={} userId={} error={}",
                                    context.getRunId(), userId, error.getMessage());
                        }
                    });
        } catch (RejectedExecutionException e) {
            logger.warn("History queue full, dropping history runId={} userId={}", context.getRunId(), userId);
        }
    }

    private ExecutionResult finish(ExecutionContext context, ExecutionResult result) {
        listeners.forEach(listener -> listener.onRunFinished(context, result));
        return result;
    }

    private record NodeOutcome(WorkflowNode node, long nanos, Map<String, Object> outputs, WorkflowException failure) {

        static NodeOutcome completed(WorkflowNode node, long nanos, Map<String, Object> outputs) {
            return new NodeOutcome(node, nanos, outputs, null);
        }

        static NodeOutcome failed(WorkflowNode node, long nanos, WorkflowException failure) {
            return new NodeOutcome(node, nanos, null, failure);
        }
    }

    private static final class NodeRunFailure extends RuntimeException {

        private final String nodeId;
        private final WorkflowException failure;

        NodeRunFailure(String nodeId, WorkflowException failure) {
            super(failure.getMessage(), failure, false, false);
            this.nodeId = nodeId;
            this.failure = failure;
        }

        String nodeId() {
            return nodeId;
        }

        WorkflowException failure() {
            return failure;
        }
    }
}

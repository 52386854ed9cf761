package ai.genflow.workflow.engine.service;

import ai.genflow.workflow.engine.context.ExecutionContext;
import ai.genflow.workflow.engine.context.NodeExecutionRecord;
import ai.genflow.workflow.graph.exception.WorkflowException;
import ai.genflow.workflow.graph.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingWorkflowRunListener implements WorkflowRunListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingWorkflowRunListener.class);

    @Override
    public void onNodeStarted(ExecutionContext context, WorkflowNode node) {
        logger.debug("Node started runId={} nodeId={} type={}", context.getRunId(), node.id(), node.type());
    }

    @Override
    public void onNodeCompleted(ExecutionContext context, WorkflowNode node, NodeExecutionRecord record) {
        logger.info("Node completed runId={} nodeId={} type={} durationMs={} collaboratorMs={}",
                context.getRunId(), node.id(), node.type(), record.durationMs(), record.collaboratorMs());
    }

    @Override
    public void onNodeFailed(ExecutionContext context, WorkflowNode node, NodeExecutionRecord record,
                             WorkflowException failure) {
        logger.warn("Node failed runId={} nodeId={} type={} kind={} durationMs={} error={}",
                context.getRunId(), node.id(), node.type(), failure.getKind(), record.durationMs(),
                failure.getMessage());
    }

    @Override
    public void onRunFinished(ExecutionContext context, ExecutionResult result) {
        if (result.succeeded()) {
            logger.info("Run completed runId={} nodes={} sources={} executionTimeMs={}",
                    result.runId(), result.executionLog().size(), result.sources().size(), result.executionTimeMs());
        } else {
            logger.warn("Run failed runId={} kind={} nodeId={} message={}",
                    result.runId(), result.failure().kind(), result.failure().nodeId(), result.failure().message());
        }
    }
}

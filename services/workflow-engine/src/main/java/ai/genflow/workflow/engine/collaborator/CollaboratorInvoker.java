package ai.genflow.workflow.engine.collaborator;

import ai.genflow.workflow.engine.config.EngineProperties;
import ai.genflow.workflow.engine.context.ExecutionContext;
import ai.genflow.workflow.graph.exception.WorkflowException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls under their deadline and retry policy.
 *
 * <p>Each attempt is bounded by the collaborator's timeout. An attempt that overruns is cancelled
 * and its worker thread interrupted. Retrieval and web search are retried with exponential backoff
 * on timeouts and transient failures; generation is attempted once. Failures surface as
 * {@link CollaboratorException} or {@link CollaboratorTimeoutException} carrying the calling
 * node's id.</p>
 */
@Component
public class CollaboratorInvoker {

    private static final Logger logger = LoggerFactory.getLogger(CollaboratorInvoker.class);

    private final ExecutorService executor;
    private final EngineProperties properties;
    private final Map<CollaboratorKind, TimeLimiter> timeLimiters = new EnumMap<>(CollaboratorKind.class);
    private final Map<CollaboratorKind, Retry> retries = new EnumMap<>(CollaboratorKind.class);

    public CollaboratorInvoker(EngineProperties properties,
                               @Qualifier("collaboratorExecutor") ExecutorService executor) {
        this.properties = properties;
        this.executor = executor;
        for (CollaboratorKind kind : CollaboratorKind.values()) {
            timeLimiters.put(kind, TimeLimiter.of(kind.name().toLowerCase(), TimeLimiterConfig.custom()
                    .timeoutDuration(properties.timeoutFor(kind))
                    .cancelRunningFuture(true)
                    .build()));
            if (kind.isRetryable() && properties.getMaxRetries() > 0) {
                retries.put(kind, Retry.of(kind.name().toLowerCase(), RetryConfig.custom()
                        .maxAttempts(properties.getMaxRetries() + 1)
                        .intervalFunction(IntervalFunction.ofExponentialBackoff(
                                properties.getRetryInitialBackoff().toMillis(),
                                properties.getRetryBackoffMultiplier(),
                                properties.getRetryMaxBackoff().toMillis()))
                        .retryOnException(CollaboratorInvoker::isTransient)
                        .build()));
            }
        }
    }

    /**
     * Invokes {@code call} for {@code nodeId} and adds the time spent, retries included, to the
     * node's collaborator latency.
     */
    public <T> T invoke(CollaboratorKind kind, ExecutionContext context, String nodeId, Supplier<T> call) {
        long started = System.nanoTime();
        try {
            return invoke(kind, nodeId, call);
        } finally {
            context.recordCollaboratorLatency(nodeId, System.nanoTime() - started);
        }
    }

    public <T> T invoke(CollaboratorKind kind, String nodeId, Supplier<T> call) {
        TimeLimiter timeLimiter = timeLimiters.get(kind);
        Callable<T> task = call::get;
        // a FutureTask, unlike a CompletableFuture, interrupts its worker when cancelled on timeout
        Callable<T> attempt = () -> timeLimiter.executeFutureSupplier(() -> executor.submit(task));
        Retry retry = retries.get(kind);
        if (retry != null) {
            attempt = Retry.decorateCallable(retry, attempt);
        }
        try {
            return attempt.call();
        } catch (TimeoutException e) {
            logger.warn("Collaborator timed out collaborator={} nodeId={} timeoutMs={}",
                    kind, nodeId, properties.timeoutFor(kind).toMillis());
            throw new CollaboratorTimeoutException(kind, nodeId, properties.timeoutFor(kind), e);
        } catch (CollaboratorException e) {
            logger.warn("Collaborator failed collaborator={} nodeId={} error={}", kind, nodeId, e.getMessage());
            throw e.forNode(nodeId);
        } catch (WorkflowException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(kind, nodeId, "Interrupted while waiting for the "
                    + kind.label() + " service", false, e);
        } catch (Exception e) {
            logger.warn("Collaborator failed collaborator={} nodeId={} error={}", kind, nodeId, e.toString());
            throw new CollaboratorException(kind, nodeId, "The " + kind.label() + " service failed: "
                    + compactErrorMessage(e), false, e);
        }
    }

    private static boolean isTransient(Throwable throwable) {
        if (throwable instanceof TimeoutException) {
            return true;
        }
        return throwable instanceof CollaboratorException collaboratorException
                && collaboratorException.isTransientFailure();
    }

    private static String compactErrorMessage(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message.length() > 300 ? message.substring(0, 300) + "..." : message;
    }
}

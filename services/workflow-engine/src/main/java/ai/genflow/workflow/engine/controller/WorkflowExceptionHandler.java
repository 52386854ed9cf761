package ai.genflow.workflow.engine.controller;

import ai.genflow.workflow.engine.dto.ErrorResponse;
import ai.genflow.workflow.graph.exception.ErrorKind;
import ai.genflow.workflow.graph.exception.GraphValidationException;
import ai.genflow.workflow.graph.exception.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Renders workflow failures as {@link ErrorResponse} bodies with a status derived from the error kind.
 */
@RestControllerAdvice
public class WorkflowExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowExceptionHandler.class);

    public static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR, CYCLE_DETECTED -> HttpStatus.BAD_REQUEST;
            case CONFIG_ERROR -> HttpStatus.UNPROCESSABLE_ENTITY;
            case COLLABORATOR_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case COLLABORATOR_ERROR -> HttpStatus.BAD_GATEWAY;
            case CANCELLED -> HttpStatus.CONFLICT;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<ErrorResponse> handleWorkflowException(WorkflowException ex) {
        List<String> errors = ex instanceof GraphValidationException validation ? validation.getErrors() : List.of();
        logger.warn("Workflow request failed kind={} nodeId={} message={}", ex.getKind(), ex.getNodeId(),
                ex.getMessage());
        return ResponseEntity.status(statusFor(ex.getKind()))
                .body(new ErrorResponse(ex.getKind().name(), ex.getNodeId(), ex.getMessage(), errors, null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(WorkflowExceptionHandler::describe)
                .sorted()
                .toList();
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorKind.VALIDATION_ERROR.name(), null,
                        "Invalid request: " + String.join("; ", errors), errors, null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorKind.VALIDATION_ERROR.name(), null,
                        "Request body is missing or is not valid JSON", List.of(), null));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}

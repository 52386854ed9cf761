package ai.genflow.workflow.engine.controller;

import ai.genflow.workflow.engine.dto.ErrorResponse;
import ai.genflow.workflow.graph.exception.ConfigException;
import ai.genflow.workflow.graph.exception.ErrorKind;
import ai.genflow.workflow.graph.exception.GraphValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowExceptionHandlerTest {

    private final WorkflowExceptionHandler handler = new WorkflowExceptionHandler();

    @Test
    void statusFor_ShouldMapEveryErrorKind() {
        assertThat(WorkflowExceptionHandler.statusFor(ErrorKind.VALIDATION_ERROR)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(WorkflowExceptionHandler.statusFor(ErrorKind.CYCLE_DETECTED)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(WorkflowExceptionHandler.statusFor(ErrorKind.CONFIG_ERROR))
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(WorkflowExceptionHandler.statusFor(ErrorKind.COLLABORATOR_TIMEOUT))
                .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(WorkflowExceptionHandler.statusFor(ErrorKind.COLLABORATOR_ERROR)).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(WorkflowExceptionHandler.statusFor(ErrorKind.CANCELLED)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(WorkflowExceptionHandler.statusFor(ErrorKind.INTERNAL_ERROR))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void handleWorkflowException_ShouldCarryNodeId() {
        ResponseEntity<ErrorResponse> response =
                handler.handleWorkflowException(new ConfigException("k1", "Option 'maxResults' must be an integer"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().getErrorKind()).isEqualTo("CONFIG_ERROR");
        assertThat(response.getBody().getNodeId()).isEqualTo("k1");
    }

    @Test
    void handleWorkflowException_ShouldListValidationErrors() {
        ResponseEntity<ErrorResponse> response = handler.handleWorkflowException(
                new GraphValidationException(List.of("Missing Output node", "Missing User Query node")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getErrors()).containsExactly("Missing Output node", "Missing User Query node");
    }
}

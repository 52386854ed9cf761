package ai.genflow.workflow.engine.collaborator.http;

import ai.genflow.workflow.engine.collaborator.CollaboratorException;
import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Translates RestClient failures into collaborator failures. Connection errors, 429 and 5xx
 * responses are transient; every other response error is permanent.
 */
final class CollaboratorHttpErrors {

    private CollaboratorHttpErrors() {
    }

    static CollaboratorException translate(CollaboratorKind kind, RestClientException ex) {
        if (ex instanceof RestClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            boolean transientFailure = status == 429 || status >= 500;
            return new CollaboratorException(kind,
                    "The " + kind.label() + " service returned HTTP " + status, transientFailure, ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new CollaboratorException(kind,
                    "The " + kind.label() + " service is unreachable: " + ex.getMessage(), true, ex);
        }
        return new CollaboratorException(kind,
                "The " + kind.label() + " service call failed: " + ex.getMessage(), false, ex);
    }

    static String normalizeBaseUrl(String baseUrl, String fallback) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return fallback;
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}

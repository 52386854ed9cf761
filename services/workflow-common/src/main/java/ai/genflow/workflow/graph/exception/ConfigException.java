package ai.genflow.workflow.graph.exception;

/**
 * A node lacks a required input or configuration value at execution time.
 */
public class ConfigException extends WorkflowException {

    public ConfigException(String nodeId, String message) {
        super(ErrorKind.CONFIG_ERROR, nodeId, message);
    }
}

package ai.genflow.workflow.engine.context;

import java.util.Objects;

/**
 * Address of a published value: the producing node and its output port.
 */
public record PortKey(String nodeId, String port) {

    public PortKey {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(port, "port");
    }

    public static PortKey of(String nodeId, String port) {
        return new PortKey(nodeId, port);
    }

    @Override
    public String toString() {
        return nodeId + "." + port;
    }
}

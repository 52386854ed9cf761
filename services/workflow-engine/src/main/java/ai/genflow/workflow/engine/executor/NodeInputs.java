package ai.genflow.workflow.engine.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved input values of one node, keyed by port.
 */
public record NodeInputs(Map<String, Object> values) {

    public NodeInputs {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static NodeInputs of(Map<String, Object> values) {
        return new NodeInputs(values);
    }

    public static NodeInputs empty() {
        return new NodeInputs(Map.of());
    }

    public boolean has(String port) {
        return values.containsKey(port);
    }

    public String getString(String port) {
        Object value = values.get(port);
        return value == null ? null : value.toString();
    }

    public String getString(String port, String defaultValue) {
        String value = getString(port);
        return value == null ? defaultValue : value;
    }

    public List<String> getStringList(String port) {
        Object value = values.get(port);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return value == null ? List.of() : List.of(value.toString());
    }
}

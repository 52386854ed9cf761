package ai.genflow.workflow.graph.model;

import ai.genflow.workflow.graph.exception.ConfigException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over a node's option map with typed accessors.
 *
 * <p>Editor payloads are loosely typed: numbers may arrive as strings and flags
 * as {@code "true"}. Accessors coerce such values and raise {@link ConfigException}
 * when a value is present but cannot be interpreted.</p>
 */
public record NodeConfig(Map<String, Object> values) {

    private static final NodeConfig EMPTY = new NodeConfig(Map.of());

    public NodeConfig {
        if (values == null) {
            values = Map.of();
        } else {
            // Map.copyOf rejects null values, which the editor emits for cleared fields
            LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
            values = Collections.unmodifiableMap(copy);
        }
    }

    public static NodeConfig empty() {
        return EMPTY;
    }

    public static NodeConfig of(Map<String, Object> values) {
        return new NodeConfig(values);
    }

    public boolean has(String key) {
        Object value = values.get(key);
        return value != null && !(value instanceof String s && s.isBlank());
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public String getString(String key, String defaultValue) {
        return getString(key).orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null || (value instanceof String s && s.isBlank())) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            if (numeric != Math.rint(numeric) || numeric < Integer.MIN_VALUE || numeric > Integer.MAX_VALUE) {
                throw invalid(key, value, "an integer");
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "an integer");
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null || (value instanceof String s && s.isBlank())) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "a number");
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null || (value instanceof String s && s.isBlank())) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw invalid(key, value, "a boolean");
    }

    /**
     * Returns a list option; a scalar value is treated as a one-element list.
     */
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null && !element.toString().isBlank()) {
                    result.add(element.toString().trim());
                }
            }
        } else if (!value.toString().isBlank()) {
            result.add(value.toString().trim());
        }
        return List.copyOf(result);
    }

    private static ConfigException invalid(String key, Object value, String expected) {
        return new ConfigException(null, "Option '" + key + "' must be " + expected + " but was '" + value + "'");
    }
}

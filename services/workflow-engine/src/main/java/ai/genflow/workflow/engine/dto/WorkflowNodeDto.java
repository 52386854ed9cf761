package ai.genflow.workflow.engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node as authored in the editor. Options are read from {@code data.config}, falling back to a
 * top-level {@code config} object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowNodeDto {

    private String id;

    private String type;

    private Map<String, Object> position = new LinkedHashMap<>();

    private Map<String, Object> data = new LinkedHashMap<>();

    private Map<String, Object> config;

    public WorkflowNodeDto() {
    }

    public WorkflowNodeDto(String id, String type, Map<String, Object> config) {
        this.id = id;
        this.type = type;
        this.data = new LinkedHashMap<>();
        this.data.put("config", config);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Map<String, Object> getPosition() {
        return position;
    }

    public void setPosition(Map<String, Object> position) {
        this.position = position;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public void setData(Map<String, Object> data) {
        this.data = data;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }
}

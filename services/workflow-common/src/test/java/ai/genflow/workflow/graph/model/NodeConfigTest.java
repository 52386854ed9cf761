package ai.genflow.workflow.graph.model;

import ai.genflow.workflow.graph.exception.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeConfigTest {

    @Test
    void testCoercesLooselyTypedValues() {
        NodeConfig config = NodeConfig.of(Map.of(
                "maxResults", "3",
                "similarityThreshold", 0.4,
                "strict", "TRUE",
                "temperature", 1));

        assertThat(config.getInt("maxResults", 5)).isEqualTo(3);
        assertThat(config.getDouble("similarityThreshold", 0.7)).isEqualTo(0.4);
        assertThat(config.getBoolean("strict", false)).isTrue();
        assertThat(config.getDouble("temperature", 0.7)).isEqualTo(1.0);
    }

    @Test
    void testDefaultsApplyToMissingAndBlankValues() {
        Map<String, Object> values = new HashMap<>();
        values.put("model", "  ");
        values.put("maxTokens", null);
        NodeConfig config = NodeConfig.of(values);

        assertThat(config.has("model")).isFalse();
        assertThat(config.getString("model", "fallback")).isEqualTo("fallback");
        assertThat(config.getInt("maxTokens", 1000)).isEqualTo(1000);
        assertThat(config.values()).doesNotContainKey("maxTokens");
    }

    @Test
    void testRejectsUninterpretableValues() {
        NodeConfig config = NodeConfig.of(Map.of("maxResults", "many", "strict", "sometimes", "maxTokens", 2.5));

        assertThatThrownBy(() -> config.getInt("maxResults", 5))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("maxResults");
        assertThatThrownBy(() -> config.getBoolean("strict", false))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> config.getInt("maxTokens", 1000))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void testRejectsIntegersOutsideIntRange() {
        NodeConfig config = NodeConfig.of(Map.of("maxResults", 4294967297L, "maxTokens", -3000000000L,
                "webSearchResults", (long) Integer.MAX_VALUE));

        assertThatThrownBy(() -> config.getInt("maxResults", 5))
                .isInstanceOf(ConfigException.class)
                .hasMessage("Option 'maxResults' must be an integer but was '4294967297'");
        assertThatThrownBy(() -> config.getInt("maxTokens", 1000))
                .isInstanceOf(ConfigException.class);
        assertThat(config.getInt("webSearchResults", 3)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void testStringListAcceptsScalarsAndCollections() {
        NodeConfig config = NodeConfig.of(Map.of("selectedDocuments", List.of("doc-1", " ", "doc-2"), "documentId", 7));

        assertThat(config.getStringList("selectedDocuments")).containsExactly("doc-1", "doc-2");
        assertThat(config.getStringList("documentId")).containsExactly("7");
        assertThat(config.getStringList("missing")).isEmpty();
    }
}

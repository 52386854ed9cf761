package ai.genflow.workflow.engine.executor;

import ai.genflow.workflow.graph.model.NodeType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeExecutorRegistryTest {

    @Test
    void testMissingExecutorFailsConstruction() {
        assertThatThrownBy(() -> new NodeExecutorRegistry(List.of(new UserQueryNodeExecutor(), new OutputNodeExecutor())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("KNOWLEDGE_BASE")
                .hasMessageContaining("LLM_ENGINE");
    }

    @Test
    void testDuplicateExecutorFailsConstruction() {
        assertThatThrownBy(() -> new NodeExecutorRegistry(List.of(new OutputNodeExecutor(), new OutputNodeExecutor())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Multiple executors");
    }

    @Test
    void testResolvesExecutorPerType() {
        NodeExecutorRegistry registry = new NodeExecutorRegistry(List.of(
                new UserQueryNodeExecutor(),
                new KnowledgeBaseNodeExecutor(null, null),
                new LlmEngineNodeExecutor(null, null, null, null),
                new OutputNodeExecutor()));

        for (NodeType type : NodeType.values()) {
            assertThat(registry.get(type).type()).isEqualTo(type);
        }
    }
}

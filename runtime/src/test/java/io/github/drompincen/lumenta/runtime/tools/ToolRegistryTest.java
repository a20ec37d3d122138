package io.github.drompincen.lumenta.runtime.tools;

import io.github.drompincen.lumenta.protocol.mcp.ToolDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(mock(ApplicationContext.class));
    }

    @Test
    void registerAndRetrieveTool() {
        registry.register(StubTool.requiring("test_tool", "value"));

        assertThat(registry.get("test_tool")).isPresent();
        assertThat(registry.get("nonexistent")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        StubTool first = StubTool.requiring("dup");
        StubTool second = StubTool.requiring("dup");
        registry.register(first);
        registry.register(second);

        assertThat(registry.all()).hasSize(1);
        assertThat(registry.get("dup")).containsSame(second);
    }

    @Test
    void descriptorsAreSortedByName() {
        registry.register(StubTool.requiring("zeta"));
        registry.register(StubTool.requiring("alpha", "x"));

        assertThat(registry.descriptors()).extracting(ToolDescriptor::name).containsExactly("alpha", "zeta");
        assertThat(registry.descriptors().get(0).inputSchema().path("required").get(0).asText()).isEqualTo("x");
    }
}

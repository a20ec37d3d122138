package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.resource.ActiveWorkflowResource;
import io.github.drompincen.lumenta.protocol.resource.NodeExecutionTrace;
import io.github.drompincen.lumenta.protocol.resource.TraceStatus;
import io.github.drompincen.lumenta.protocol.resource.WorkflowStatus;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import io.github.drompincen.lumenta.runtime.tools.ToolCallOrigin;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TriggerWorkflowToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResourceStore store;
    private TriggerWorkflowTool tool;
    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        store = new ResourceStore(new LumentaProperties());
        tool = new TriggerWorkflowTool();
        tool.setResourceStore(store);
        ctx = ToolContext.of("call-1", ToolCallOrigin.ORCHESTRATOR);
        store.addWorkflow(new ActiveWorkflowResource("w1", "Porch", WorkflowStatus.PAUSED, null, null, 2, Map.of()));
    }

    @Test
    void toolMetadata() {
        assertThat(tool.name()).isEqualTo("trigger_workflow");
        assertThat(tool.description()).isNotBlank();
        assertThat(tool.inputSchema().path("required").get(0).asText()).isEqualTo("workflowId");
    }

    @Test
    void setsWorkflowRunningAndRecordsTrace() {
        ObjectNode args = MAPPER.createObjectNode().put("workflowId", "w1");
        args.putObject("input").put("reason", "person detected");

        ToolResult result = tool.execute(ctx, args);

        assertThat(result.error()).isFalse();
        JsonNode payload = result.payload();
        assertThat(payload.path("success").asBoolean()).isTrue();
        assertThat(payload.path("message").asText()).isEqualTo("Workflow triggered successfully");
        assertThat(payload.path("input").path("reason").asText()).isEqualTo("person detected");

        ActiveWorkflowResource workflow = store.getWorkflow("w1").orElseThrow();
        assertThat(workflow.status()).isEqualTo(WorkflowStatus.RUNNING);
        assertThat(workflow.lastEventAt()).isNotNull();

        List<NodeExecutionTrace> traces = store.listTraces("w1");
        assertThat(traces).hasSize(1);
        NodeExecutionTrace trace = traces.get(0);
        assertThat(trace.nodeType()).isEqualTo(TriggerWorkflowTool.TRIGGER_NODE);
        assertThat(trace.status()).isEqualTo(TraceStatus.FINISHED);
        assertThat(trace.input()).containsEntry("reason", "person detected");
        assertThat(trace.output()).containsEntry("triggeredBy", "orchestrator");
    }

    @Test
    void unknownWorkflowIsAnErrorResult() {
        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("workflowId", "w9"));

        assertThat(result.error()).isTrue();
        assertThat(result.payload().path("error").asText()).isEqualTo("Workflow not found: w9");
        assertThat(store.listTraces(null)).isEmpty();
    }

    @Test
    void failsWithoutResourceStore() {
        TriggerWorkflowTool unwired = new TriggerWorkflowTool();

        ToolResult result = unwired.execute(ctx, MAPPER.createObjectNode().put("workflowId", "w1"));

        assertThat(result.error()).isTrue();
    }
}

package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.resource.ActiveWorkflowResource;
import io.github.drompincen.lumenta.protocol.resource.NodeExecutionTrace;
import io.github.drompincen.lumenta.protocol.resource.TraceStatus;
import io.github.drompincen.lumenta.protocol.resource.WorkflowStatus;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import io.github.drompincen.lumenta.runtime.tools.Tool;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public class TriggerWorkflowTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final String TRIGGER_NODE = "trigger";

    private ResourceStore resourceStore;

    @Override public String name() { return "trigger_workflow"; }
    @Override public String description() { return "Trigger a workflow to start or resume execution with optional input data"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("workflowId").put("type", "string").put("description", "The ID of the workflow to trigger");
        props.putObject("input").put("type", "object").put("description", "Optional input data to pass to the workflow");
        schema.putArray("required").add("workflowId");
        return schema;
    }

    public void setResourceStore(ResourceStore resourceStore) {
        this.resourceStore = resourceStore;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode arguments) {
        if (resourceStore == null) {
            return ToolResult.failure("Resource store not available");
        }
        String workflowId = arguments.path("workflowId").asText();
        JsonNode input = arguments.path("input");

        Instant now = Instant.now();
        Optional<ActiveWorkflowResource> updated =
                resourceStore.updateWorkflow(workflowId, w -> w.withStatus(WorkflowStatus.RUNNING, now));
        if (updated.isEmpty()) {
            return ToolResult.failure("Workflow not found: " + workflowId);
        }

        Map<String, Object> traceInput = input.isObject()
                ? MAPPER.convertValue(input, new TypeReference<Map<String, Object>>() {})
                : Map.of();
        resourceStore.addTrace(new NodeExecutionTrace(null, workflowId, TRIGGER_NODE, TRIGGER_NODE, now,
                TraceStatus.FINISHED, traceInput, Map.of("triggeredBy", ctx.origin().wire()), null, 0L));

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("workflowId", workflowId);
        result.put("message", "Workflow triggered successfully");
        if (input.isObject()) {
            result.set("input", input);
        }
        return ToolResult.success(result);
    }
}

package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.resource.WorkflowGraph;
import io.github.drompincen.lumenta.runtime.graph.GraphMutation;
import io.github.drompincen.lumenta.runtime.graph.GraphMutationException;
import io.github.drompincen.lumenta.runtime.graph.GraphOperation;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import io.github.drompincen.lumenta.runtime.tools.Tool;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;

import java.util.Arrays;
import java.util.Map;

public class MutateGraphTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResourceStore resourceStore;

    @Override public String name() { return "mutate_graph"; }
    @Override public String description() { return "Modify a workflow graph by adding, removing, or updating nodes and edges"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("workflowId").put("type", "string").put("description", "The ID of the workflow to modify");
        ObjectNode operation = props.putObject("operation");
        operation.put("type", "string").put("description", "The type of graph mutation operation");
        ArrayNode ops = operation.putArray("enum");
        Arrays.stream(GraphOperation.values()).forEach(op -> ops.add(op.wire()));
        props.putObject("nodeId").put("type", "string").put("description", "Node ID (required for node operations)");
        props.putObject("nodeType").put("type", "string").put("description", "Node type (required for add_node)");
        props.putObject("nodeConfig").put("type", "object").put("description", "Node configuration (for add_node/update_node)");
        props.putObject("edgeId").put("type", "string").put("description", "Edge ID (required for remove_edge/update_edge)");
        props.putObject("sourceId").put("type", "string").put("description", "Source node ID (required for add_edge)");
        props.putObject("targetId").put("type", "string").put("description", "Target node ID (required for add_edge)");
        props.putObject("edgeConfig").put("type", "object").put("description", "Edge configuration (optional for add_edge/update_edge)");
        schema.putArray("required").add("workflowId").add("operation");
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
        String operationName = arguments.path("operation").asText();
        GraphOperation operation = GraphOperation.fromWire(operationName).orElse(null);
        if (operation == null) {
            return ToolResult.failure("Unknown graph operation: " + operationName);
        }

        GraphMutation mutation = new GraphMutation(operation,
                text(arguments, "nodeId"), text(arguments, "nodeType"), map(arguments, "nodeConfig"),
                text(arguments, "edgeId"), text(arguments, "sourceId"), text(arguments, "targetId"),
                map(arguments, "edgeConfig"));

        WorkflowGraph graph;
        try {
            graph = resourceStore.mutateGraph(workflowId, mutation);
        } catch (GraphMutationException e) {
            ObjectNode failure = MAPPER.createObjectNode();
            failure.put("success", false);
            failure.put("error", e.getMessage());
            failure.put("workflowId", workflowId);
            failure.put("operation", operation.wire());
            return ToolResult.failure(failure);
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", true);
        result.put("message", "Graph mutation operation '" + operation.wire() + "' completed");
        result.put("workflowId", workflowId);
        result.put("operation", operation.wire());
        result.put("nodeCount", graph.nodes().size());
        result.put("edgeCount", graph.edges().size());
        return ToolResult.success(result);
    }

    private static String text(JsonNode arguments, String field) {
        JsonNode value = arguments.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Map<String, Object> map(JsonNode arguments, String field) {
        JsonNode value = arguments.get(field);
        return value != null && value.isObject()
                ? MAPPER.convertValue(value, new TypeReference<Map<String, Object>>() {})
                : null;
    }
}

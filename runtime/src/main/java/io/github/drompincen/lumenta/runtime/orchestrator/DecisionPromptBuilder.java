package io.github.drompincen.lumenta.runtime.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.mcp.ToolDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DecisionPromptBuilder {

    private static final String TEMPLATE = """
            You are an autonomous orchestration agent for Lumenta, a smart environment orchestration platform. \
            Your role is to observe the physical world through camera detections, audio transcripts, and video \
            summaries, understand what is happening, and take actions by calling available tools.

            Current System State:
            %s

            Available Tools:
            %s

            Your Responsibilities:
            1. Analyze recent detections, workflows, and execution traces
            2. Identify situations that require action based on workflow intents
            3. Decide which tools to call and with what parameters
            4. Act autonomously to enforce the configured intents

            Important Guidelines:
            - Only call tools when there's a clear reason based on the current state
            - Consider workflow configurations and their intended behaviors
            - For detections with high severity, consider triggering workflows or sending notifications
            - When workflows are paused or stopped but should be running, trigger them
            - Use send_notification for important alerts or incidents
            - Use mutate_graph sparingly and only when workflows need to adapt to new patterns

            Respond with a JSON object in this format:
            {
              "reasoning": "Your analysis of the current state and what actions are needed",
              "toolCalls": [
                {
                  "name": "tool_name",
                  "arguments": { ... }
                }
              ]
            }

            If no actions are needed, return an empty toolCalls array.""";

    private final ObjectMapper objectMapper;

    public DecisionPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String build(OrchestrationSnapshot snapshot, List<ToolDescriptor> tools) {
        ArrayNode toolList = objectMapper.createArrayNode();
        for (ToolDescriptor tool : tools) {
            ObjectNode entry = toolList.addObject();
            entry.put("name", tool.name());
            entry.put("description", tool.description());
            entry.set("parameters", tool.inputSchema().path("properties").deepCopy());
            entry.set("required", tool.inputSchema().has("required")
                    ? tool.inputSchema().get("required").deepCopy()
                    : objectMapper.createArrayNode());
        }
        return TEMPLATE.formatted(pretty(snapshot), pretty(toolList));
    }

    private String pretty(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render orchestration prompt", e);
        }
    }
}

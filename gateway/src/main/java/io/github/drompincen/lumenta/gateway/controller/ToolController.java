package io.github.drompincen.lumenta.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.lumenta.protocol.mcp.ToolDescriptor;
import io.github.drompincen.lumenta.runtime.tools.InvalidToolArgumentsException;
import io.github.drompincen.lumenta.runtime.tools.ToolCallOrigin;
import io.github.drompincen.lumenta.runtime.tools.ToolCallService;
import io.github.drompincen.lumenta.runtime.tools.ToolRegistry;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator view of the registered tools. Invocations take the same path as {@code tools/call}.
 */
@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final ToolCallService toolCallService;

    public ToolController(ToolRegistry toolRegistry, ToolCallService toolCallService) {
        this.toolRegistry = toolRegistry;
        this.toolCallService = toolCallService;
    }

    @GetMapping
    public List<ToolDescriptor> list() {
        return toolRegistry.descriptors();
    }

    @GetMapping("/{name}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String name) {
        return toolRegistry.get(name)
                .map(t -> ResponseEntity.ok(new ToolDescriptor(t.name(), t.description(), t.inputSchema())))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/invoke")
    public ResponseEntity<?> invoke(@PathVariable String name, @RequestBody(required = false) JsonNode arguments) {
        if (toolRegistry.get(name).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        try {
            ToolResult result = toolCallService.call(name, arguments, ToolCallOrigin.REST);
            return ResponseEntity.ok(result);
        } catch (InvalidToolArgumentsException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("data", e.data());
            return ResponseEntity.badRequest().body(body);
        }
    }
}

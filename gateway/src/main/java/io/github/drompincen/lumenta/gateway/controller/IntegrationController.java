package io.github.drompincen.lumenta.gateway.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.api.IntegrationsRequest;
import io.github.drompincen.lumenta.protocol.integration.Integration;
import io.github.drompincen.lumenta.runtime.integration.IntegrationStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Dashboard integrations. A sync is all-or-nothing: one malformed entry rejects the batch and
 * leaves the current set in place.
 */
@RestController
@RequestMapping("/api/mcp/integrations")
public class IntegrationController {

    private final IntegrationStore integrationStore;
    private final ObjectMapper objectMapper;

    public IntegrationController(IntegrationStore integrationStore, ObjectMapper objectMapper) {
        this.integrationStore = integrationStore;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    public ResponseEntity<?> handle(@RequestBody IntegrationsRequest request) {
        String action = request != null ? request.action() : null;
        if ("sync".equals(action)) {
            List<JsonNode> raw = request.integrations() != null ? request.integrations() : List.of();
            List<Integration> decoded = new ArrayList<>(raw.size());
            for (int i = 0; i < raw.size(); i++) {
                try {
                    decoded.add(decode(raw.get(i)));
                } catch (JsonProcessingException e) {
                    return invalid(i, e.getOriginalMessage());
                } catch (IllegalArgumentException e) {
                    return invalid(i, e.getMessage());
                }
            }
            integrationStore.sync(decoded);
            return ResponseEntity.ok(Map.of("success", true, "message", "Synced " + decoded.size() + " integrations"));
        }
        if ("get".equals(action)) {
            return ResponseEntity.ok(list());
        }
        return ResponseEntity.badRequest().body(Map.of("error", "Unknown action: " + action));
    }

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("success", true, "integrations", integrationStore.all());
    }

    private static ResponseEntity<Map<String, String>> invalid(int index, String reason) {
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid integration at index " + index + ": " + reason));
    }

    private Integration decode(JsonNode node) throws JsonProcessingException {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("integration must be a JSON object");
        }
        Integration integration = objectMapper.treeToValue(node, Integration.class);
        if (integration.id() == null || integration.id().isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        if (integration.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        return integration;
    }
}

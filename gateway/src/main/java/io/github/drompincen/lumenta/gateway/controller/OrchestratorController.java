package io.github.drompincen.lumenta.gateway.controller;

import io.github.drompincen.lumenta.protocol.api.OrchestratorRequest;
import io.github.drompincen.lumenta.runtime.orchestrator.OrchestrationLoop;
import io.github.drompincen.lumenta.runtime.orchestrator.OrchestratorStatus;
import io.github.drompincen.lumenta.runtime.orchestrator.PassOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/mcp/orchestrator")
public class OrchestratorController {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorController.class);

    private final OrchestrationLoop orchestrator;

    public OrchestratorController(OrchestrationLoop orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<?> control(@RequestBody OrchestratorRequest request) {
        String action = request != null ? request.action() : null;
        try {
            if ("start".equals(action)) {
                Duration interval = request.interval() != null ? Duration.ofMillis(request.interval()) : null;
                OrchestratorStatus status = orchestrator.start(interval, request.apiKey());
                return ResponseEntity.ok(Map.of(
                        "success", true,
                        "message", "Orchestrator started",
                        "interval", status.interval()));
            }
            if ("stop".equals(action)) {
                orchestrator.stop();
                return ResponseEntity.ok(Map.of("success", true, "message", "Orchestrator stopped"));
            }
            if ("trigger".equals(action)) {
                PassOutcome outcome = orchestrator.trigger();
                return ResponseEntity.ok(Map.of(
                        "success", true,
                        "message", "Orchestration triggered",
                        "outcome", outcome));
            }
            if ("status".equals(action)) {
                return ResponseEntity.ok(statusBody());
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.debug("Orchestrator {} rejected: {}", action, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.badRequest().body(Map.of("error", "Unknown action: " + action));
    }

    @GetMapping
    public Map<String, Object> status() {
        return statusBody();
    }

    private Map<String, Object> statusBody() {
        OrchestratorStatus status = orchestrator.status();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", orchestrator.isRunning());
        body.put("state", status.state());
        body.put("interval", status.interval());
        body.put("passes", status.passes());
        body.put("skipped", status.skipped());
        body.put("lastPassAt", status.lastPassAt());
        body.put("lastOutcome", status.lastOutcome());
        return body;
    }
}

package io.github.drompincen.lumenta.gateway.controller;

import io.github.drompincen.lumenta.protocol.api.ActionExecutionResult;
import io.github.drompincen.lumenta.protocol.api.ActionRequest;
import io.github.drompincen.lumenta.runtime.action.ActionNodeExecutor;
import io.github.drompincen.lumenta.runtime.action.ActionOption;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/mcp/execute-action")
public class ActionController {

    private final ActionNodeExecutor executor;

    public ActionController(ActionNodeExecutor executor) {
        this.executor = executor;
    }

    @PostMapping
    public ResponseEntity<?> execute(@RequestBody ActionRequest request) {
        if (request == null || request.config() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Action node config is required"));
        }
        Optional<ActionOption> option = ActionOption.fromWire(request.config().option());
        if (option.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Invalid action option. Must be 'call', 'email', or 'text'"));
        }

        ActionExecutionResult result = executor.execute(option.get(), request.config().description(), request.apiKey());
        return result.success()
                ? ResponseEntity.ok(result)
                : ResponseEntity.internalServerError().body(result);
    }
}

package io.github.drompincen.lumenta.gateway.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.jsonrpc.JsonRpcResponse;
import io.github.drompincen.lumenta.runtime.mcp.McpDispatcher;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * JSON-RPC endpoint. The body is taken raw so that malformed JSON is answered with a
 * {@code -32700} envelope instead of Spring's default error page.
 */
@RestController
@RequestMapping("/api/mcp")
public class McpController {

    private final McpDispatcher dispatcher;

    public McpController(McpDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JsonRpcResponse> rpc(@RequestBody(required = false) String body) {
        JsonRpcResponse response = dispatcher.handle(body);
        HttpStatus status = McpDispatcher.isEnvelopeError(response) ? HttpStatus.BAD_REQUEST : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode capabilities() {
        return dispatcher.serverCapabilities();
    }
}

package io.github.drompincen.lumenta.gateway.controller;

import io.github.drompincen.lumenta.protocol.api.IngestRequest;
import io.github.drompincen.lumenta.protocol.resource.ResourceKind;
import io.github.drompincen.lumenta.protocol.resource.StoredResource;
import io.github.drompincen.lumenta.runtime.store.ResourceDecoder;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import io.github.drompincen.lumenta.runtime.store.ResourceValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/mcp/ingest")
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);

    private final ResourceDecoder decoder;
    private final ResourceStore store;

    public IngestController(ResourceDecoder decoder, ResourceStore store) {
        this.decoder = decoder;
        this.store = store;
    }

    @PostMapping
    public ResponseEntity<?> ingest(@RequestBody IngestRequest request) {
        if (request == null || request.type() == null || request.type().isBlank()
                || request.data() == null || request.data().isNull()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing required fields: type and data"));
        }

        StoredResource stored;
        try {
            ResourceKind kind = decoder.kindOf(request.type());
            stored = store.add(kind, decoder.decode(request.type(), request.data()));
        } catch (ResourceValidationException e) {
            log.debug("Rejected {} ingest: {}", request.type(), e.getMessage());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            if (e.field() != null) {
                body.put("field", e.field());
            }
            return ResponseEntity.badRequest().body(body);
        }

        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Event type '" + request.type() + "' ingested successfully",
                "id", stored.id()));
    }
}

package io.github.drompincen.lumenta.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record IngestRequest(
        String type,
        JsonNode data
) {}

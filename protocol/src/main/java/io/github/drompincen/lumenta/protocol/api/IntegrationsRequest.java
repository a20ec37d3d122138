package io.github.drompincen.lumenta.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Integrations stay raw here so each one can be decoded and rejected individually.
 */
public record IntegrationsRequest(
        String action,
        List<JsonNode> integrations
) {}

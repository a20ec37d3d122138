package io.github.drompincen.lumenta.protocol.integration;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.drompincen.lumenta.protocol.resource.Payloads;

import java.util.Map;

/**
 * A user-configured dashboard integration. {@code config} is opaque outside integration routing;
 * {@code toolName} binds the integration to one declared tool.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Integration(
        String id,
        String name,
        String icon,
        String description,
        IntegrationStatus status,
        Map<String, Object> config,
        String toolName
) {
    public Integration {
        config = Payloads.freezeOrEmpty(config);
    }

    public boolean active() {
        return status == IntegrationStatus.ACTIVE;
    }
}

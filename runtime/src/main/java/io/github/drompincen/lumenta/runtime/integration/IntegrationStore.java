package io.github.drompincen.lumenta.runtime.integration;

import io.github.drompincen.lumenta.protocol.integration.Integration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Integrations synced from the dashboard. A sync replaces the whole set atomically.
 */
@Component
public class IntegrationStore {

    private static final Logger log = LoggerFactory.getLogger(IntegrationStore.class);

    private volatile Map<String, Integration> integrations = Map.of();

    public void sync(List<Integration> incoming) {
        Map<String, Integration> next = new LinkedHashMap<>();
        for (Integration integration : incoming) {
            next.put(integration.id(), integration);
        }
        integrations = Collections.unmodifiableMap(next);
        log.info("Synced {} integrations ({} active)", next.size(), active().size());
    }

    public List<Integration> all() {
        return new ArrayList<>(integrations.values());
    }

    public List<Integration> active() {
        return integrations.values().stream().filter(Integration::active).toList();
    }

    /** Active integrations bound to the tool, in sync order. */
    public List<Integration> activeFor(String toolName) {
        return integrations.values().stream()
                .filter(Integration::active)
                .filter(i -> toolName.equals(i.toolName()))
                .toList();
    }
}

package io.github.drompincen.lumenta.protocol.resource;

import java.time.Instant;

/**
 * Common shape of every record held by the resource store.
 */
public interface StoredResource {

    String id();

    Instant timestamp();

    ResourceKind kind();

    /**
     * Returns a copy with a store-assigned id and timestamp where the originals are absent,
     * or {@code this} when both are already present.
     */
    StoredResource withDefaults(String generatedId, Instant now);
}

package io.github.drompincen.lumenta.runtime.store;

import io.github.drompincen.lumenta.protocol.resource.ResourceKind;
import io.github.drompincen.lumenta.protocol.resource.StoredResource;

/**
 * A stored (or replaced) resource as seen by subscribers.
 */
public record StoreEvent(
        ResourceKind kind,
        StoredResource data
) {
    public String type() {
        return kind.wire();
    }
}

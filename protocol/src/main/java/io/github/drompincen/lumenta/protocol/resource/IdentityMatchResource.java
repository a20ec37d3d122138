package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A person seen on a feed, optionally matched to a known identity. Unresolved matches
 * ({@code matchedIdentityId == null}) are retained like any other.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdentityMatchResource(
        String id,
        Instant timestamp,
        String feedId,
        String detectedPersonId,
        String matchedIdentityId,
        double confidence,
        BoundingBox boundingBox
) implements StoredResource {

    @Override
    public ResourceKind kind() {
        return ResourceKind.IDENTITY_MATCH;
    }

    @Override
    public IdentityMatchResource withDefaults(String generatedId, Instant now) {
        if (id != null && timestamp != null) {
            return this;
        }
        return new IdentityMatchResource(id != null ? id : generatedId, timestamp != null ? timestamp : now,
                feedId, detectedPersonId, matchedIdentityId, confidence, boundingBox);
    }

    public boolean resolved() {
        return matchedIdentityId != null;
    }
}

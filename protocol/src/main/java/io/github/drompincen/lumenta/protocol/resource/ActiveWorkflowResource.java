package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * A workflow known to the runtime. After creation only {@code status} changes through the
 * orchestration path, together with the {@code lastEventAt} stamp; graph mutations also
 * refresh {@code nodeCount}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActiveWorkflowResource(
        String id,
        String name,
        WorkflowStatus status,
        Instant startedAt,
        Instant lastEventAt,
        int nodeCount,
        Map<String, Object> config
) implements StoredResource {

    public ActiveWorkflowResource {
        config = Payloads.freezeOrEmpty(config);
    }

    @Override
    public Instant timestamp() {
        return lastEventAt != null ? lastEventAt : startedAt;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.WORKFLOW;
    }

    @Override
    public ActiveWorkflowResource withDefaults(String generatedId, Instant now) {
        if (id != null && startedAt != null) {
            return this;
        }
        return new ActiveWorkflowResource(id != null ? id : generatedId, name, status,
                startedAt != null ? startedAt : now, lastEventAt, nodeCount, config);
    }

    public ActiveWorkflowResource withStatus(WorkflowStatus newStatus, Instant at) {
        return new ActiveWorkflowResource(id, name, newStatus, startedAt, at, nodeCount, config);
    }

    public ActiveWorkflowResource withNodeCount(int count, Instant at) {
        return new ActiveWorkflowResource(id, name, status, startedAt, at, count, config);
    }
}

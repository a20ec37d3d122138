package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResource(
        String id,
        Instant timestamp,
        String feedId,
        String feedName,
        DetectionType type,
        List<BoundingBox> boxes,
        List<String> labels,
        List<Double> confidences,
        String description,
        Severity severity
) implements StoredResource {

    public DetectionResource {
        boxes = Payloads.list(boxes);
        labels = Payloads.list(labels);
        confidences = Payloads.list(confidences);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.DETECTION;
    }

    @Override
    public DetectionResource withDefaults(String generatedId, Instant now) {
        if (id != null && timestamp != null) {
            return this;
        }
        return new DetectionResource(id != null ? id : generatedId, timestamp != null ? timestamp : now,
                feedId, feedName, type, boxes, labels, confidences, description, severity);
    }

    /** Confidences clamped to [0, 1]; the stored values are kept as ingested. */
    public List<Double> clampedConfidences() {
        return confidences.stream()
                .map(c -> c == null ? 0.0 : Math.max(0.0, Math.min(1.0, c)))
                .toList();
    }

    public DetectionResource withClampedConfidences() {
        return new DetectionResource(id, timestamp, feedId, feedName, type, boxes, labels,
                clampedConfidences(), description, severity);
    }
}

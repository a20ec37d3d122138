package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VideoSummaryResource(
        String id,
        Instant timestamp,
        String feedId,
        SummaryPeriod summaryPeriod,
        String summary,
        List<KeyMoment> keyMoments
) implements StoredResource {

    public record SummaryPeriod(Instant start, Instant end) {}

    /** {@code timestamp} is the offset in seconds into the summarized period. */
    public record KeyMoment(double timestamp, String description, double confidence) {}

    public VideoSummaryResource {
        // stable sort: moments sharing a timestamp keep their ingestion order
        keyMoments = keyMoments == null ? List.of()
                : keyMoments.stream().sorted(Comparator.comparingDouble(KeyMoment::timestamp)).toList();
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.SUMMARY;
    }

    @Override
    public VideoSummaryResource withDefaults(String generatedId, Instant now) {
        if (id != null && timestamp != null) {
            return this;
        }
        return new VideoSummaryResource(id != null ? id : generatedId, timestamp != null ? timestamp : now,
                feedId, summaryPeriod, summary, keyMoments);
    }
}

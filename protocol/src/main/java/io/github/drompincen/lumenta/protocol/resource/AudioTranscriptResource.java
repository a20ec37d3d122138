package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AudioTranscriptResource(
        String id,
        Instant timestamp,
        String feedId,
        double startTime,
        double endTime,
        String transcript,
        double confidence,
        String language
) implements StoredResource {

    @Override
    public ResourceKind kind() {
        return ResourceKind.TRANSCRIPT;
    }

    @Override
    public AudioTranscriptResource withDefaults(String generatedId, Instant now) {
        if (id != null && timestamp != null) {
            return this;
        }
        return new AudioTranscriptResource(id != null ? id : generatedId, timestamp != null ? timestamp : now,
                feedId, startTime, endTime, transcript, confidence, language);
    }
}

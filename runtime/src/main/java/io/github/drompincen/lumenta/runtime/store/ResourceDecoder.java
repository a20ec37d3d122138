package io.github.drompincen.lumenta.runtime.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.resource.ActiveWorkflowResource;
import io.github.drompincen.lumenta.protocol.resource.AudioTranscriptResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionType;
import io.github.drompincen.lumenta.protocol.resource.IdentityMatchResource;
import io.github.drompincen.lumenta.protocol.resource.NodeExecutionTrace;
import io.github.drompincen.lumenta.protocol.resource.ResourceKind;
import io.github.drompincen.lumenta.protocol.resource.Severity;
import io.github.drompincen.lumenta.protocol.resource.StoredResource;
import io.github.drompincen.lumenta.protocol.resource.TraceStatus;
import io.github.drompincen.lumenta.protocol.resource.VideoSummaryResource;
import io.github.drompincen.lumenta.protocol.resource.WorkflowStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Decodes ingested {@code {type, data}} payloads into resource records, reporting the first
 * offending field. Nothing is stored here; a decode failure leaves the store untouched.
 */
@Component
public class ResourceDecoder {

    private final ObjectMapper objectMapper;

    public ResourceDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ResourceKind kindOf(String type) {
        return ResourceKind.fromWire(type)
                .orElseThrow(() -> new ResourceValidationException("Unknown event type: " + type));
    }

    public StoredResource decode(String type, JsonNode data) {
        ResourceKind kind = kindOf(type);
        if (data == null || !data.isObject()) {
            throw new ResourceValidationException("data", "data must be a JSON object");
        }
        optionalText(data, "id");
        optionalInstant(data, "timestamp");
        return switch (kind) {
            case DETECTION -> decodeDetection(data);
            case IDENTITY_MATCH -> decodeIdentityMatch(data);
            case TRANSCRIPT -> decodeTranscript(data);
            case SUMMARY -> decodeSummary(data);
            case WORKFLOW -> decodeWorkflow(data);
            case TRACE -> decodeTrace(data);
        };
    }

    private DetectionResource decodeDetection(JsonNode data) {
        requireText(data, "feedId");
        requireEnum(data, "type", DetectionType::fromWire);
        optionalEnum(data, "severity", Severity::fromWire);
        optionalArray(data, "boxes");
        optionalArray(data, "labels");
        optionalArray(data, "confidences");
        return convert(data, DetectionResource.class);
    }

    private IdentityMatchResource decodeIdentityMatch(JsonNode data) {
        requireText(data, "feedId");
        requireText(data, "detectedPersonId");
        optionalText(data, "matchedIdentityId");
        requireNumber(data, "confidence");
        return convert(data, IdentityMatchResource.class);
    }

    private AudioTranscriptResource decodeTranscript(JsonNode data) {
        requireText(data, "feedId");
        requireText(data, "transcript");
        requireNumber(data, "startTime");
        requireNumber(data, "endTime");
        return convert(data, AudioTranscriptResource.class);
    }

    private VideoSummaryResource decodeSummary(JsonNode data) {
        requireText(data, "feedId");
        requireText(data, "summary");
        JsonNode period = data.path("summaryPeriod");
        if (!period.isMissingNode() && !period.isNull()) {
            if (!period.isObject()) {
                throw new ResourceValidationException("summaryPeriod", "summaryPeriod must be an object");
            }
            optionalInstant(period, "start", "summaryPeriod.start");
            optionalInstant(period, "end", "summaryPeriod.end");
        }
        optionalArray(data, "keyMoments");
        return convert(data, VideoSummaryResource.class);
    }

    private ActiveWorkflowResource decodeWorkflow(JsonNode data) {
        requireText(data, "name");
        requireEnum(data, "status", WorkflowStatus::fromWire);
        optionalInstant(data, "startedAt");
        optionalInstant(data, "lastEventAt");
        JsonNode nodeCount = data.path("nodeCount");
        if (!nodeCount.isMissingNode() && !nodeCount.isNull()
                && (!nodeCount.canConvertToInt() || !nodeCount.isIntegralNumber() || nodeCount.asInt() < 0)) {
            throw new ResourceValidationException("nodeCount", "nodeCount must be a non-negative integer");
        }
        JsonNode config = data.path("config");
        if (!config.isMissingNode() && !config.isNull() && !config.isObject()) {
            throw new ResourceValidationException("config", "config must be an object");
        }
        return convert(data, ActiveWorkflowResource.class);
    }

    private NodeExecutionTrace decodeTrace(JsonNode data) {
        requireText(data, "workflowId");
        requireText(data, "nodeId");
        requireText(data, "nodeType");
        requireEnum(data, "status", TraceStatus::fromWire);
        return convert(data, NodeExecutionTrace.class);
    }

    private <T> T convert(JsonNode data, Class<T> type) {
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonMappingException e) {
            throw new ResourceValidationException(fieldOf(e), "Invalid " + describe(fieldOf(e)) + ": " + e.getOriginalMessage());
        } catch (JsonProcessingException e) {
            throw new ResourceValidationException(e.getOriginalMessage());
        }
    }

    private static String fieldOf(JsonMappingException e) {
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.append('[').append(ref.getIndex()).append(']');
            }
        }
        return path.length() == 0 ? null : path.toString();
    }

    private static String describe(String field) {
        return field == null ? "payload" : "field '" + field + "'";
    }

    private static void requireText(JsonNode data, String field) {
        JsonNode value = data.path(field);
        if (value.isMissingNode() || value.isNull()) {
            throw new ResourceValidationException(field, "Missing required field: " + field);
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ResourceValidationException(field, field + " must be a non-empty string");
        }
    }

    private static void optionalText(JsonNode data, String field) {
        JsonNode value = data.path(field);
        if (!value.isMissingNode() && !value.isNull() && !value.isTextual()) {
            throw new ResourceValidationException(field, field + " must be a string");
        }
    }

    private static void requireNumber(JsonNode data, String field) {
        JsonNode value = data.path(field);
        if (value.isMissingNode() || value.isNull()) {
            throw new ResourceValidationException(field, "Missing required field: " + field);
        }
        if (!value.isNumber()) {
            throw new ResourceValidationException(field, field + " must be a number");
        }
    }

    private static void optionalArray(JsonNode data, String field) {
        JsonNode value = data.path(field);
        if (!value.isMissingNode() && !value.isNull() && !value.isArray()) {
            throw new ResourceValidationException(field, field + " must be an array");
        }
    }

    private static void requireEnum(JsonNode data, String field, Function<String, Optional<?>> lookup) {
        JsonNode value = data.path(field);
        if (value.isMissingNode() || value.isNull()) {
            throw new ResourceValidationException(field, "Missing required field: " + field);
        }
        optionalEnum(data, field, lookup);
    }

    private static void optionalEnum(JsonNode data, String field, Function<String, Optional<?>> lookup) {
        JsonNode value = data.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return;
        }
        if (!value.isTextual() || lookup.apply(value.asText()).isEmpty()) {
            throw new ResourceValidationException(field, "Invalid value for " + field + ": " + value);
        }
    }

    private static void optionalInstant(JsonNode data, String field) {
        optionalInstant(data, field, field);
    }

    private static void optionalInstant(JsonNode data, String field, String reportedAs) {
        JsonNode value = data.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return;
        }
        if (!value.isTextual()) {
            throw new ResourceValidationException(reportedAs, reportedAs + " must be an ISO-8601 timestamp");
        }
        try {
            Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            throw new ResourceValidationException(reportedAs, reportedAs + " must be an ISO-8601 timestamp");
        }
    }
}

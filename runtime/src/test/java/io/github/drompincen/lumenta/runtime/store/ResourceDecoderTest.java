package io.github.drompincen.lumenta.runtime.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.Json;
import io.github.drompincen.lumenta.protocol.resource.ActiveWorkflowResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionType;
import io.github.drompincen.lumenta.protocol.resource.NodeExecutionTrace;
import io.github.drompincen.lumenta.protocol.resource.ResourceKind;
import io.github.drompincen.lumenta.protocol.resource.TraceStatus;
import io.github.drompincen.lumenta.protocol.resource.VideoSummaryResource;
import io.github.drompincen.lumenta.protocol.resource.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceDecoderTest {

    private final ObjectMapper mapper = Json.newMapper();
    private final ResourceDecoder decoder = new ResourceDecoder(mapper);

    @Test
    void decodesDetection() throws Exception {
        var data = mapper.readTree("""
                {"id":"d1","timestamp":"2025-03-01T10:00:00Z","feedId":"cam-1","type":"person",
                 "boxes":[{"x":1,"y":2,"width":3,"height":4}],"labels":["person"],"confidences":[0.8],
                 "severity":"high"}
                """);

        DetectionResource detection = (DetectionResource) decoder.decode("detection", data);

        assertThat(detection.id()).isEqualTo("d1");
        assertThat(detection.timestamp()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
        assertThat(detection.type()).isEqualTo(DetectionType.PERSON);
        assertThat(detection.boxes()).hasSize(1);
        assertThat(detection.boxes().get(0).width()).isEqualTo(3.0);
    }

    @Test
    void unknownTypeHasNoField() {
        assertThatThrownBy(() -> decoder.decode("telemetry", mapper.createObjectNode()))
                .isInstanceOfSatisfying(ResourceValidationException.class, e -> {
                    assertThat(e.field()).isNull();
                    assertThat(e.getMessage()).contains("telemetry");
                });
    }

    @Test
    void missingRequiredFieldIsReported() {
        ObjectNode data = mapper.createObjectNode().put("type", "person");

        assertThatThrownBy(() -> decoder.decode("detection", data))
                .isInstanceOfSatisfying(ResourceValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("feedId"));
    }

    @Test
    void invalidEnumValueIsReported() {
        ObjectNode data = mapper.createObjectNode().put("feedId", "cam").put("type", "spaceship");

        assertThatThrownBy(() -> decoder.decode("detection", data))
                .isInstanceOfSatisfying(ResourceValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("type"));
    }

    @Test
    void malformedTimestampIsReported() {
        ObjectNode data = mapper.createObjectNode()
                .put("feedId", "cam").put("type", "motion").put("timestamp", "yesterday");

        assertThatThrownBy(() -> decoder.decode("detection", data))
                .isInstanceOfSatisfying(ResourceValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("timestamp"));
    }

    @Test
    void numericFieldsMustBeNumbers() {
        ObjectNode data = mapper.createObjectNode()
                .put("feedId", "cam").put("detectedPersonId", "p1").put("confidence", "high");

        assertThatThrownBy(() -> decoder.decode("identity_match", data))
                .isInstanceOfSatisfying(ResourceValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("confidence"));
    }

    @Test
    void workflowNodeCountMustBeNonNegative() {
        ObjectNode data = mapper.createObjectNode()
                .put("name", "Night watch").put("status", "running").put("nodeCount", -1);

        assertThatThrownBy(() -> decoder.decode("workflow", data))
                .isInstanceOfSatisfying(ResourceValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("nodeCount"));
    }

    @Test
    void decodesWorkflowTraceAndSummary() throws Exception {
        ActiveWorkflowResource workflow = (ActiveWorkflowResource) decoder.decode("workflow", mapper.readTree("""
                {"id":"w1","name":"Night watch","status":"paused","nodeCount":3,"config":{"zone":"lobby"}}
                """));
        NodeExecutionTrace trace = (NodeExecutionTrace) decoder.decode("trace", mapper.readTree("""
                {"workflowId":"w1","nodeId":"n1","nodeType":"camera","status":"error","error":"offline"}
                """));
        VideoSummaryResource summary = (VideoSummaryResource) decoder.decode("summary", mapper.readTree("""
                {"feedId":"cam","summary":"quiet night",
                 "summaryPeriod":{"start":"2025-03-01T00:00:00Z","end":"2025-03-01T06:00:00Z"},
                 "keyMoments":[{"timestamp":30,"description":"door","confidence":0.7},
                               {"timestamp":10,"description":"car","confidence":0.9}]}
                """));

        assertThat(workflow.status()).isEqualTo(WorkflowStatus.PAUSED);
        assertThat(workflow.config()).containsEntry("zone", "lobby");
        assertThat(trace.status()).isEqualTo(TraceStatus.ERROR);
        assertThat(trace.kind()).isEqualTo(ResourceKind.TRACE);
        assertThat(summary.keyMoments()).extracting(VideoSummaryResource.KeyMoment::description)
                .containsExactly("car", "door");
    }

    @Test
    void dataMustBeAnObject() {
        assertThatThrownBy(() -> decoder.decode("transcript", mapper.createArrayNode()))
                .isInstanceOfSatisfying(ResourceValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("data"));
    }
}

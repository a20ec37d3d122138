package io.github.drompincen.lumenta.runtime.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.Json;
import io.github.drompincen.lumenta.protocol.mcp.McpResourceContent;
import io.github.drompincen.lumenta.protocol.mcp.McpResourceDescriptor;
import io.github.drompincen.lumenta.protocol.resource.ActiveWorkflowResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionType;
import io.github.drompincen.lumenta.protocol.resource.NodeExecutionTrace;
import io.github.drompincen.lumenta.protocol.resource.Severity;
import io.github.drompincen.lumenta.protocol.resource.TraceStatus;
import io.github.drompincen.lumenta.protocol.resource.WorkflowStatus;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import io.github.drompincen.lumenta.runtime.graph.GraphMutation;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResourceCatalogTest {

    private final ObjectMapper mapper = Json.newMapper();
    private ResourceStore store;
    private ResourceCatalog catalog;

    @BeforeEach
    void setUp() {
        store = new ResourceStore(new LumentaProperties());
        catalog = new ResourceCatalog(store, mapper);
        store.addDetection(detection("d1", "cam-1"));
        store.addDetection(detection("d2", "cam-2"));
        store.addWorkflow(new ActiveWorkflowResource("w1", "Porch", WorkflowStatus.RUNNING, null, null, 0, Map.of()));
        store.addTrace(new NodeExecutionTrace("t1", "w1", "n1", "camera", null, TraceStatus.FINISHED, null, null, null, 5L));
        store.addTrace(new NodeExecutionTrace("t2", "w2", "n1", "camera", null, TraceStatus.ERROR, null, null, "boom", 5L));
    }

    @Test
    void listsAllCollections() {
        assertThat(catalog.list()).extracting(McpResourceDescriptor::uri).contains(
                "lumenta://detections", "lumenta://identity-matches", "lumenta://workflows/{workflowId}/graph",
                "lumenta://traces/{workflowId}");
    }

    @Test
    void readsCollectionsAndFeeds() throws Exception {
        assertThat(array("lumenta://detections")).hasSize(2);
        assertThat(array("lumenta://detections/cam-2")).hasSize(1);
        assertThat(array("lumenta://detections/cam-9")).isEmpty();
        assertThat(array("lumenta://transcripts")).isEmpty();
    }

    @Test
    void singleDetectionMustBelongToFeed() {
        assertThat(catalog.read("lumenta://detections/cam-1/d1")).isPresent();
        assertThat(catalog.read("lumenta://detections/cam-2/d1")).isEmpty();
    }

    @Test
    void tracesFilterByWorkflow() throws Exception {
        assertThat(array("lumenta://traces")).hasSize(2);
        assertThat(array("lumenta://traces/w1")).hasSize(1);
        assertThat(catalog.read("lumenta://traces/w2/t1")).isEmpty();
    }

    @Test
    void readsWorkflowGraph() throws Exception {
        store.mutateGraph("w1", GraphMutation.addNode("n1", "camera", Map.of()));

        McpResourceContent content = catalog.read("lumenta://workflows/w1/graph").orElseThrow();

        JsonNode graph = mapper.readTree(content.text());
        assertThat(graph.path("nodes").size()).isEqualTo(1);
        assertThat(content.uri()).isEqualTo("lumenta://workflows/w1/graph");
    }

    @Test
    void trailingSlashIsIgnored() {
        assertThat(catalog.read("lumenta://workflows/w1/")).isPresent();
    }

    @Test
    void rejectsMalformedAndUnknownUris() {
        assertThat(catalog.read("http://detections")).isEmpty();
        assertThat(catalog.read("lumenta://")).isEmpty();
        assertThat(catalog.read("lumenta://cameras")).isEmpty();
        assertThat(catalog.read("lumenta://workflows//graph")).isEmpty();
        assertThat(catalog.read("lumenta://workflows/w1/nodes")).isEmpty();
        assertThat(catalog.read("lumenta://summaries/s1/extra")).isEmpty();
    }

    private JsonNode array(String uri) throws Exception {
        JsonNode node = mapper.readTree(catalog.read(uri).orElseThrow().text());
        assertThat(node.isArray()).isTrue();
        return node;
    }

    private static DetectionResource detection(String id, String feedId) {
        return new DetectionResource(id, null, feedId, null, DetectionType.PERSON, null,
                List.of("person"), List.of(0.8), "person", Severity.MEDIUM);
    }
}

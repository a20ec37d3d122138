package io.github.drompincen.lumenta.runtime.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.protocol.mcp.McpResourceContent;
import io.github.drompincen.lumenta.protocol.mcp.McpResourceDescriptor;
import io.github.drompincen.lumenta.protocol.resource.ResourceKind;
import io.github.drompincen.lumenta.runtime.store.ResourceStore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps {@code lumenta://} URIs onto the resource store.
 */
@Component
public class ResourceCatalog {

    private static final String MIME_TYPE = "application/json";

    private static final List<McpResourceDescriptor> DESCRIPTORS = List.of(
            McpResourceDescriptor.json("lumenta://detections", "Camera Detections",
                    "Latest camera detection events from all feeds"),
            McpResourceDescriptor.json("lumenta://detections/{feedId}", "Camera Detections by Feed",
                    "Camera detection events for a specific feed"),
            McpResourceDescriptor.json("lumenta://identity-matches", "Identity Matches",
                    "Person identity recognition and matching results"),
            McpResourceDescriptor.json("lumenta://transcripts", "Audio Transcripts",
                    "Speech-to-text transcripts from audio feeds"),
            McpResourceDescriptor.json("lumenta://summaries", "Video Summaries",
                    "Summaries of video feed activity"),
            McpResourceDescriptor.json("lumenta://workflows", "Active Workflows",
                    "Currently running workflow configurations"),
            McpResourceDescriptor.json("lumenta://workflows/{workflowId}", "Workflow Details",
                    "Detailed information about a specific workflow"),
            McpResourceDescriptor.json("lumenta://workflows/{workflowId}/graph", "Workflow Graph",
                    "Nodes and edges of a workflow"),
            McpResourceDescriptor.json("lumenta://traces", "Execution Traces",
                    "Node execution traces from workflow runtime"),
            McpResourceDescriptor.json("lumenta://traces/{workflowId}", "Workflow Execution Traces",
                    "Execution traces for a specific workflow"));

    private final ResourceStore store;
    private final ObjectMapper objectMapper;

    public ResourceCatalog(ResourceStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public List<McpResourceDescriptor> list() {
        return DESCRIPTORS;
    }

    /**
     * Current state behind {@code uri}, or empty when the URI is malformed, names an unknown
     * collection, or names a single resource that does not exist.
     */
    public Optional<McpResourceContent> read(String uri) {
        return ResourceUri.parse(uri)
                .flatMap(this::resolve)
                .map(value -> new McpResourceContent(uri, MIME_TYPE, render(value)));
    }

    private Optional<Object> resolve(ResourceUri uri) {
        Optional<ResourceKind> kind = ResourceKind.fromSegment(uri.segment());
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        return switch (kind.get()) {
            case DETECTION -> detections(uri);
            case WORKFLOW -> workflows(uri);
            case TRACE -> traces(uri);
            case IDENTITY_MATCH -> collection(uri, store.listIdentityMatches(), ResourceKind.IDENTITY_MATCH);
            case TRANSCRIPT -> collection(uri, store.listTranscripts(), ResourceKind.TRANSCRIPT);
            case SUMMARY -> collection(uri, store.listSummaries(), ResourceKind.SUMMARY);
        };
    }

    private Optional<Object> detections(ResourceUri uri) {
        return switch (uri.depth()) {
            case 0 -> Optional.of(store.listDetections());
            case 1 -> Optional.of(store.listDetectionsByFeed(uri.part(0)));
            case 2 -> store.getDetection(uri.part(1))
                    .filter(d -> Objects.equals(d.feedId(), uri.part(0)))
                    .map(d -> d);
            default -> Optional.empty();
        };
    }

    private Optional<Object> workflows(ResourceUri uri) {
        return switch (uri.depth()) {
            case 0 -> Optional.of(store.listWorkflows());
            case 1 -> store.getWorkflow(uri.part(0)).map(w -> w);
            case 2 -> "graph".equals(uri.part(1))
                    ? store.graph(uri.part(0)).map(g -> g)
                    : Optional.empty();
            default -> Optional.empty();
        };
    }

    private Optional<Object> traces(ResourceUri uri) {
        return switch (uri.depth()) {
            case 0 -> Optional.of(store.listTraces(null));
            case 1 -> Optional.of(store.listTraces(uri.part(0)));
            case 2 -> store.getTrace(uri.part(1))
                    .filter(t -> Objects.equals(t.workflowId(), uri.part(0)))
                    .map(t -> t);
            default -> Optional.empty();
        };
    }

    private Optional<Object> collection(ResourceUri uri, List<?> latest, ResourceKind kind) {
        return switch (uri.depth()) {
            case 0 -> Optional.of(latest);
            case 1 -> store.get(kind, uri.part(0)).map(r -> r);
            default -> Optional.empty();
        };
    }

    private String render(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render resource", e);
        }
    }
}

package io.github.drompincen.lumenta.protocol.resource;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a workflow's node graph.
 */
public record WorkflowGraph(
        String workflowId,
        List<Node> nodes,
        List<Edge> edges
) {
    public record Node(String id, String type, Map<String, Object> config) {
        public Node {
            config = Payloads.freezeOrEmpty(config);
        }
    }

    public record Edge(String id, String sourceId, String targetId, Map<String, Object> config) {
        public Edge {
            config = Payloads.freezeOrEmpty(config);
        }
    }

    public WorkflowGraph {
        nodes = Payloads.list(nodes);
        edges = Payloads.list(edges);
    }

    public static WorkflowGraph empty(String workflowId) {
        return new WorkflowGraph(workflowId, List.of(), List.of());
    }
}

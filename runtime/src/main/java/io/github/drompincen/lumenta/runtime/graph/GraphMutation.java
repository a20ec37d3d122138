package io.github.drompincen.lumenta.runtime.graph;

import java.util.Map;

/**
 * One structural change to a workflow graph. Which fields are required depends on the operation;
 * {@link MutableWorkflowGraph#apply} enforces them.
 */
public record GraphMutation(
        GraphOperation operation,
        String nodeId,
        String nodeType,
        Map<String, Object> nodeConfig,
        String edgeId,
        String sourceId,
        String targetId,
        Map<String, Object> edgeConfig
) {
    public static GraphMutation addNode(String nodeId, String nodeType, Map<String, Object> config) {
        return new GraphMutation(GraphOperation.ADD_NODE, nodeId, nodeType, config, null, null, null, null);
    }

    public static GraphMutation removeNode(String nodeId) {
        return new GraphMutation(GraphOperation.REMOVE_NODE, nodeId, null, null, null, null, null, null);
    }

    public static GraphMutation addEdge(String edgeId, String sourceId, String targetId) {
        return new GraphMutation(GraphOperation.ADD_EDGE, null, null, null, edgeId, sourceId, targetId, null);
    }
}

package io.github.drompincen.lumenta.runtime.graph;

import io.github.drompincen.lumenta.protocol.resource.WorkflowGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Working copy of a workflow graph. Edges always connect existing nodes.
 */
public class MutableWorkflowGraph {

    private final Map<String, WorkflowGraph.Node> nodes = new LinkedHashMap<>();
    private final Map<String, WorkflowGraph.Edge> edges = new LinkedHashMap<>();

    public MutableWorkflowGraph() {
    }

    public MutableWorkflowGraph(WorkflowGraph graph) {
        graph.nodes().forEach(n -> nodes.put(n.id(), n));
        graph.edges().forEach(e -> edges.put(e.id(), e));
    }

    public void apply(GraphMutation mutation) {
        if (mutation.operation() == null) {
            throw new GraphMutationException("operation is required");
        }
        switch (mutation.operation()) {
            case ADD_NODE -> addNode(mutation);
            case REMOVE_NODE -> removeNode(mutation);
            case UPDATE_NODE -> updateNode(mutation);
            case ADD_EDGE -> addEdge(mutation);
            case REMOVE_EDGE -> removeEdge(mutation);
            case UPDATE_EDGE -> updateEdge(mutation);
        }
    }

    public int nodeCount() {
        return nodes.size();
    }

    public WorkflowGraph snapshot(String workflowId) {
        return new WorkflowGraph(workflowId, new ArrayList<>(nodes.values()), new ArrayList<>(edges.values()));
    }

    private void addNode(GraphMutation m) {
        String nodeId = require(m.nodeId(), "nodeId", m);
        String nodeType = require(m.nodeType(), "nodeType", m);
        if (nodes.containsKey(nodeId)) {
            throw new GraphMutationException("Node already exists: " + nodeId);
        }
        nodes.put(nodeId, new WorkflowGraph.Node(nodeId, nodeType, m.nodeConfig()));
    }

    private void removeNode(GraphMutation m) {
        String nodeId = require(m.nodeId(), "nodeId", m);
        if (nodes.remove(nodeId) == null) {
            throw new GraphMutationException("Unknown node: " + nodeId);
        }
        edges.values().removeIf(e -> e.sourceId().equals(nodeId) || e.targetId().equals(nodeId));
    }

    private void updateNode(GraphMutation m) {
        String nodeId = require(m.nodeId(), "nodeId", m);
        WorkflowGraph.Node current = nodes.get(nodeId);
        if (current == null) {
            throw new GraphMutationException("Unknown node: " + nodeId);
        }
        String type = m.nodeType() != null ? m.nodeType() : current.type();
        nodes.put(nodeId, new WorkflowGraph.Node(nodeId, type, merge(current.config(), m.nodeConfig())));
    }

    private void addEdge(GraphMutation m) {
        String sourceId = require(m.sourceId(), "sourceId", m);
        String targetId = require(m.targetId(), "targetId", m);
        requireNode(sourceId);
        requireNode(targetId);
        String edgeId = m.edgeId() != null ? m.edgeId() : sourceId + "->" + targetId;
        if (edges.containsKey(edgeId)) {
            throw new GraphMutationException("Edge already exists: " + edgeId);
        }
        edges.put(edgeId, new WorkflowGraph.Edge(edgeId, sourceId, targetId, m.edgeConfig()));
    }

    private void removeEdge(GraphMutation m) {
        String edgeId = require(m.edgeId(), "edgeId", m);
        if (edges.remove(edgeId) == null) {
            throw new GraphMutationException("Unknown edge: " + edgeId);
        }
    }

    private void updateEdge(GraphMutation m) {
        String edgeId = require(m.edgeId(), "edgeId", m);
        WorkflowGraph.Edge current = edges.get(edgeId);
        if (current == null) {
            throw new GraphMutationException("Unknown edge: " + edgeId);
        }
        String sourceId = m.sourceId() != null ? m.sourceId() : current.sourceId();
        String targetId = m.targetId() != null ? m.targetId() : current.targetId();
        requireNode(sourceId);
        requireNode(targetId);
        edges.put(edgeId, new WorkflowGraph.Edge(edgeId, sourceId, targetId,
                merge(current.config(), m.edgeConfig())));
    }

    private void requireNode(String nodeId) {
        if (!nodes.containsKey(nodeId)) {
            throw new GraphMutationException("Unknown node: " + nodeId);
        }
    }

    private static String require(String value, String field, GraphMutation m) {
        if (value == null || value.isBlank()) {
            throw new GraphMutationException("'" + field + "' is required for " + m.operation().wire());
        }
        return value;
    }

    private static Map<String, Object> merge(Map<String, Object> current, Map<String, Object> patch) {
        if (patch == null) {
            return current;
        }
        Map<String, Object> merged = new LinkedHashMap<>(current);
        merged.putAll(patch);
        return merged;
    }
}

package io.github.drompincen.lumenta.runtime.graph;

import io.github.drompincen.lumenta.protocol.resource.WorkflowGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MutableWorkflowGraphTest {

    private MutableWorkflowGraph graph;

    @BeforeEach
    void setUp() {
        graph = new MutableWorkflowGraph();
        graph.apply(GraphMutation.addNode("cam", "camera", Map.of("feedId", "cam-1")));
        graph.apply(GraphMutation.addNode("alert", "action", Map.of("option", "email")));
    }

    @Test
    void addEdgeDefaultsIdFromEndpoints() {
        graph.apply(GraphMutation.addEdge(null, "cam", "alert"));

        WorkflowGraph snapshot = graph.snapshot("w1");
        assertThat(snapshot.edges()).extracting(WorkflowGraph.Edge::id).containsExactly("cam->alert");
    }

    @Test
    void addNodeRequiresIdAndType() {
        assertThatThrownBy(() -> graph.apply(GraphMutation.addNode("x", null, null)))
                .isInstanceOf(GraphMutationException.class)
                .hasMessageContaining("nodeType");
        assertThatThrownBy(() -> graph.apply(GraphMutation.addNode("cam", "camera", null)))
                .hasMessageContaining("already exists");
    }

    @Test
    void edgeEndpointsMustExist() {
        assertThatThrownBy(() -> graph.apply(GraphMutation.addEdge("e1", "cam", "ghost")))
                .isInstanceOf(GraphMutationException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void removeNodeDropsIncidentEdges() {
        graph.apply(GraphMutation.addEdge("e1", "cam", "alert"));
        graph.apply(GraphMutation.removeNode("alert"));

        WorkflowGraph snapshot = graph.snapshot("w1");
        assertThat(snapshot.nodes()).extracting(WorkflowGraph.Node::id).containsExactly("cam");
        assertThat(snapshot.edges()).isEmpty();
        assertThat(graph.nodeCount()).isEqualTo(1);
    }

    @Test
    void updateNodeMergesConfig() {
        graph.apply(new GraphMutation(GraphOperation.UPDATE_NODE, "alert", null, Map.of("description", "email ops"),
                null, null, null, null));

        WorkflowGraph.Node alert = graph.snapshot("w1").nodes().get(1);
        assertThat(alert.type()).isEqualTo("action");
        assertThat(alert.config()).containsEntry("option", "email").containsEntry("description", "email ops");
    }

    @Test
    void updateAndRemoveEdge() {
        graph.apply(GraphMutation.addEdge("e1", "cam", "alert"));
        graph.apply(new GraphMutation(GraphOperation.UPDATE_EDGE, null, null, null, "e1", null, null,
                Map.of("label", "on person")));

        assertThat(graph.snapshot("w1").edges().get(0).config()).containsEntry("label", "on person");

        graph.apply(new GraphMutation(GraphOperation.REMOVE_EDGE, null, null, null, "e1", null, null, null));
        assertThat(graph.snapshot("w1").edges()).isEmpty();
        assertThatThrownBy(() -> graph.apply(new GraphMutation(GraphOperation.REMOVE_EDGE, null, null, null,
                "e1", null, null, null))).hasMessageContaining("Unknown edge");
    }
}

package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.ActionPayload;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GraphLinearizer")
class GraphLinearizerTest {

    private static GraphNode node(String id) {
        return new GraphNode(id, id, new ActionPayload("send_email", Map.of()), null);
    }

    @Test
    @DisplayName("orders sources before targets regardless of declaration order")
    void topologicalOrder() {
        List<GraphNode> nodes = List.of(node("c"), node("b"), node("a"));
        List<GraphEdge> edges = List.of(new GraphEdge("1", "a", "b"), new GraphEdge("2", "b", "c"));

        assertThat(GraphLinearizer.order(nodes, edges)).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("breaks ties by declaration order")
    void tiesByDeclarationOrder() {
        List<GraphNode> nodes = List.of(node("root"), node("y"), node("x"));
        List<GraphEdge> edges = List.of(new GraphEdge("1", "root", "x"), new GraphEdge("2", "root", "y"));

        assertThat(GraphLinearizer.order(nodes, edges)).containsExactly("root", "y", "x");
    }

    @Test
    @DisplayName("falls back to declaration order when edges form a cycle")
    void cycleFallsBackToDeclarationOrder() {
        List<GraphNode> nodes = List.of(node("a"), node("b"));
        List<GraphEdge> edges = List.of(new GraphEdge("1", "a", "b"), new GraphEdge("2", "b", "a", BranchTag.NONE));

        assertThat(GraphLinearizer.order(nodes, edges)).containsExactly("a", "b");
    }

    @Test
    @DisplayName("ignores edges with unknown endpoints and includes disconnected nodes")
    void ignoresDanglingEdges() {
        List<GraphNode> nodes = List.of(node("a"), node("lonely"), node("b"));
        List<GraphEdge> edges = List.of(new GraphEdge("1", "b", "a"), new GraphEdge("2", "ghost", "b"));

        assertThat(GraphLinearizer.order(nodes, edges)).containsExactly("lonely", "b", "a");
    }

    @Test
    @DisplayName("returns an empty order for an empty graph")
    void emptyGraph() {
        assertThat(GraphLinearizer.order(List.of(), List.of())).isEmpty();
    }
}

package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Orders graph nodes so that every edge source comes before its target.
 * <p>
 * Kahn's algorithm over all edges, branch tags ignored. Among nodes that are ready at the same
 * time the one declared first wins, so repeated calls on the same graph give the same order.
 * Edges with an unknown endpoint are ignored. If the edges contain a cycle the sort is abandoned
 * and the nodes are returned in declaration order. Never throws.
 * </p>
 */
@Slf4j
public final class GraphLinearizer {

    private GraphLinearizer() {
    }

    public static List<String> order(List<GraphNode> nodes, List<GraphEdge> edges) {
        if (nodes == null || nodes.isEmpty()) {
            return List.of();
        }
        int n = nodes.size();
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indexById.putIfAbsent(nodes.get(i).id(), i);
        }

        int[] inDegree = new int[n];
        List<List<Integer>> children = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            children.add(new ArrayList<>());
        }
        if (edges != null) {
            for (GraphEdge edge : edges) {
                if (edge == null) {
                    continue;
                }
                Integer source = indexById.get(edge.source());
                Integer target = indexById.get(edge.target());
                if (source == null || target == null) {
                    continue;
                }
                children.get(source).add(target);
                inDegree[target]++;
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        List<String> ordered = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int current = ready.poll();
            ordered.add(nodes.get(current).id());
            for (int child : children.get(current)) {
                if (--inDegree[child] == 0) {
                    ready.add(child);
                }
            }
        }

        if (ordered.size() < n) {
            log.debug("Cycle detected, sorted {} of {} nodes; using declaration order", ordered.size(), n);
            return declarationOrder(nodes);
        }
        return ordered;
    }

    private static List<String> declarationOrder(List<GraphNode> nodes) {
        List<String> ids = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }
}

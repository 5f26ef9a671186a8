package com.putman.sim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable graph value: nodes in generation order, edges in generation
 * order (pairs i &lt; j in nested-loop order).
 *
 * <p>
 * The constructor enforces the structural invariants: unique node ids, unique
 * edge ids, and every edge endpoint present in the node list. A new value is
 * produced whenever weights change ({@link #withEdges(List)}), so a graph
 * captured by one step is never altered by a later one.
 */
public record Graph(List<Node> nodes, List<Edge> edges) {

    public Graph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);

        Set<String> nodeIds = new HashSet<>(nodes.size() * 2);
        for (Node n : nodes)
            if (!nodeIds.add(n.id()))
                throw new IllegalArgumentException("Duplicate node id: " + n.id());

        Set<String> edgeIds = new HashSet<>(edges.size() * 2);
        for (Edge e : edges) {
            if (!edgeIds.add(e.id()))
                throw new IllegalArgumentException("Duplicate edge id: " + e.id());
            if (!nodeIds.contains(e.source()) || !nodeIds.contains(e.target()))
                throw new IllegalArgumentException("Edge " + e.id() + " references a node outside the graph");
        }
    }

    public static Graph empty() {
        return new Graph(List.of(), List.of());
    }

    /** Same nodes, replacement edges. */
    public Graph withEdges(List<Edge> newEdges) {
        return new Graph(nodes, newEdges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>(nodes.size());
        for (Node n : nodes)
            ids.add(n.id());
        return ids;
    }

    public List<String> edgeIds() {
        List<String> ids = new ArrayList<>(edges.size());
        for (Edge e : edges)
            ids.add(e.id());
        return ids;
    }

    /** Edge id to weight, in edge order. */
    public Map<String, Double> edgeWeights() {
        Map<String, Double> weights = new LinkedHashMap<>(edges.size() * 2);
        for (Edge e : edges)
            weights.put(e.id(), e.weight());
        return Collections.unmodifiableMap(weights);
    }
}

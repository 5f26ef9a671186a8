package com.putman.sim.engine;

import com.putman.sim.model.Edge;
import com.putman.sim.model.Graph;
import com.putman.sim.model.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adjacency -- CSR-encoded incidence lists of an undirected graph.
 *
 * <p>
 * Built once per step from an immutable {@link Graph} and discarded before the
 * next step. Each edge is registered with both endpoints, so a node's incident
 * list holds every edge touching it, in edge order.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>{@code edges}: the graph's edges, in graph order.</li>
 * <li>{@code incidentList}: one flattened int array with the edge indices of
 * all nodes.</li>
 * <li>{@code incidentOffset}: incidentOffset[i] points to the start of node
 * i's edges; they run up to incidentOffset[i+1] exclusive.</li>
 * </ul>
 */
public final class Adjacency {
    private final String[] nodeIds;
    private final Edge[] edges;
    private final int[] incidentOffset;
    private final int[] incidentList;
    private final Map<String, Integer> nameToIndex;

    private Adjacency(String[] nodeIds, Edge[] edges, int[] incidentOffset, int[] incidentList,
            Map<String, Integer> nameToIndex) {
        this.nodeIds = nodeIds;
        this.edges = edges;
        this.incidentOffset = incidentOffset;
        this.incidentList = incidentList;
        this.nameToIndex = nameToIndex;
    }

    public static Adjacency of(Graph graph) {
        Builder b = builder();
        for (Node n : graph.nodes())
            b.addNode(n.id());
        for (Edge e : graph.edges())
            b.addEdge(e);
        return b.build();
    }

    public int nodeCount() {
        return nodeIds.length;
    }

    public String nodeId(int index) {
        return nodeIds[index];
    }

    /** Resolves a node id to its index. O(1) hash lookup. */
    public int index(String nodeId) {
        Integer idx = nameToIndex.get(nodeId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return idx;
    }

    public boolean contains(String nodeId) {
        return nameToIndex.containsKey(nodeId);
    }

    public int degree(int index) {
        return incidentOffset[index + 1] - incidentOffset[index];
    }

    public int degree(String nodeId) {
        return nameToIndex.containsKey(nodeId) ? degree(index(nodeId)) : 0;
    }

    /** The k-th edge incident to node {@code index}. */
    public Edge incident(int index, int k) {
        return edges[incidentList[incidentOffset[index] + k]];
    }

    /** Incident edges of a node, in edge order; empty for unknown ids. */
    public List<Edge> incidentEdges(String nodeId) {
        Integer idx = nameToIndex.get(nodeId);
        if (idx == null)
            return List.of();
        int d = degree(idx);
        List<Edge> out = new ArrayList<>(d);
        for (int k = 0; k < d; k++)
            out.add(incident(idx, k));
        return out;
    }

    /** Mean weight of the incident edges, 0 for an isolated node. */
    public double meanIncidentWeight(String nodeId) {
        Integer idx = nameToIndex.get(nodeId);
        if (idx == null)
            return 0.0;
        int d = degree(idx);
        if (d == 0)
            return 0.0;
        double sum = 0.0;
        for (int k = 0; k < d; k++)
            sum += incident(idx, k).weight();
        return sum / d;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Adjacency. Rejects duplicate nodes and edges whose endpoints
     * were not added first.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<Edge> edges = new ArrayList<>();

        public Builder addNode(String nodeId) {
            if (nameToIdx.containsKey(nodeId))
                throw new IllegalArgumentException("Duplicate node id: " + nodeId);
            nameToIdx.put(nodeId, nodes.size());
            nodes.add(nodeId);
            return this;
        }

        public Builder addEdge(Edge edge) {
            requireIndex(edge.source());
            requireIndex(edge.target());
            edges.add(edge);
            return this;
        }

        private int requireIndex(String nodeId) {
            Integer idx = nameToIdx.get(nodeId);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + nodeId);
            return idx;
        }

        public Adjacency build() {
            int n = nodes.size();

            // 1. Degrees
            int[] offsets = new int[n + 1];
            for (Edge e : edges) {
                offsets[nameToIdx.get(e.source()) + 1]++;
                offsets[nameToIdx.get(e.target()) + 1]++;
            }
            for (int i = 0; i < n; i++)
                offsets[i + 1] += offsets[i];

            // 2. Fill in edge order so every incident list keeps graph order
            int[] cursor = new int[n];
            int[] flat = new int[offsets[n]];
            for (int ei = 0; ei < edges.size(); ei++) {
                Edge e = edges.get(ei);
                int s = nameToIdx.get(e.source());
                int t = nameToIdx.get(e.target());
                flat[offsets[s] + cursor[s]++] = ei;
                flat[offsets[t] + cursor[t]++] = ei;
            }

            return new Adjacency(nodes.toArray(new String[0]), edges.toArray(new Edge[0]), offsets, flat,
                    new HashMap<>(nameToIdx));
        }
    }
}

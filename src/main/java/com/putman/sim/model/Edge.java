package com.putman.sim.model;

import java.util.Objects;

/**
 * An undirected edge stored with a fixed source/target order (source is the
 * endpoint generated first).
 *
 * @param id     derived from the endpoint pair, see {@link #idOf(String, String)}.
 * @param weight current weight in [0, 1]; replaced every step by the updater.
 * @param prior  true iff both endpoints are prior nodes.
 */
public record Edge(String id, String source, String target, double weight, boolean prior) {

    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (source.equals(target))
            throw new IllegalArgumentException("Self-edge not allowed: " + source);
    }

    public static String idOf(String source, String target) {
        return source + "->" + target;
    }

    /** Returns the endpoint opposite to {@code nodeId}. */
    public String other(String nodeId) {
        return source.equals(nodeId) ? target : source;
    }

    public boolean touches(String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }

    public Edge withWeight(double newWeight) {
        return new Edge(id, source, target, newWeight, prior);
    }
}

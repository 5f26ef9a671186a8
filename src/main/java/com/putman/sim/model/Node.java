package com.putman.sim.model;

import java.util.Objects;

/**
 * A generated graph node. Immutable once generated.
 *
 * @param id    stable identifier, unique within the run.
 * @param prior member of the prior population.
 * @param novel member of the novel population; the two flags overlap on a
 *              band of nodes by construction.
 */
public record Node(String id, boolean prior, boolean novel) {
    public Node {
        Objects.requireNonNull(id, "id");
    }
}

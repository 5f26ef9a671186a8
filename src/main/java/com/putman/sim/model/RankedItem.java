package com.putman.sim.model;

/** An id with its score, as listed in an interpretation summary. */
public record RankedItem(String id, double score) {
}

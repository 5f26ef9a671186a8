package com.putman.sim.model;

/**
 * Result of a run: the graph and context after the last step, and the RunLog.
 */
public record SimulationOutput(Graph finalGraph, ContextVector finalContext, RunLog runlog) {
}

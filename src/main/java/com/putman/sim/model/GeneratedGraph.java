package com.putman.sim.model;

/** Output of the graph generator: the initial graph and its context vector. */
public record GeneratedGraph(Graph graph, ContextVector context) {
}

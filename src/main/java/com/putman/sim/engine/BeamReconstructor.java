package com.putman.sim.engine;

import com.putman.sim.model.BeamCandidate;
import com.putman.sim.model.Edge;
import com.putman.sim.model.Graph;
import com.putman.sim.util.Rounding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Bounded-width best-first path search over the pruned graph.
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Seed one single-node candidate per active node, or per each of the first
 * (up to) three graph nodes when nothing is active. A seed scores its own
 * activation.</li>
 * <li>Run {@value #EXPANSION_ROUNDS} rounds. Each round extends every candidate
 * along every incident edge to a node not yet on its path, scoring
 * {@code round3(parent + neighbour activation + edge weight)}.</li>
 * <li>Pool all extensions, sort by score descending then by concatenated node
 * path ascending, and keep the first {@code beamWidth}.</li>
 * <li>Stop early when a round produces no extension; the previous beam
 * stands.</li>
 * </ol>
 * Output is identical for identical (graph, scores, activeSet, beamWidth).
 */
public final class BeamReconstructor {
    public static final int EXPANSION_ROUNDS = 3;
    static final int FALLBACK_SEEDS = 3;

    static final Comparator<BeamCandidate> RANKING = Comparator
            .comparingDouble(BeamCandidate::score).reversed()
            .thenComparing(BeamCandidate::pathKey);

    private BeamReconstructor() {
        // Utility class
    }

    public static List<BeamCandidate> reconstruct(Graph graph, Map<String, Double> scores, List<String> activeSet,
            int beamWidth) {
        Adjacency adjacency = Adjacency.of(graph);

        List<String> seeds = !activeSet.isEmpty()
                ? activeSet
                : graph.nodeIds().subList(0, Math.min(FALLBACK_SEEDS, graph.nodeCount()));

        List<BeamCandidate> beams = new ArrayList<>(seeds.size());
        for (String seed : seeds)
            beams.add(BeamCandidate.seed(seed, scores.getOrDefault(seed, 0.0)));

        for (int round = 0; round < EXPANSION_ROUNDS; round++) {
            List<BeamCandidate> expansions = new ArrayList<>();
            for (BeamCandidate beam : beams) {
                String tail = beam.tail();
                for (Edge edge : adjacency.incidentEdges(tail)) {
                    String next = edge.other(tail);
                    if (beam.visits(next))
                        continue;
                    double score = Rounding.round3(beam.score() + scores.getOrDefault(next, 0.0) + edge.weight());
                    expansions.add(beam.extend(next, edge.id(), score));
                }
            }

            if (expansions.isEmpty())
                break;
            expansions.sort(RANKING);
            beams = new ArrayList<>(expansions.subList(0, Math.min(beamWidth, expansions.size())));
        }

        return List.copyOf(beams);
    }
}

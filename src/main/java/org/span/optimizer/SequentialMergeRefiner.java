package org.span.optimizer;

import org.span.hypergraph.Hyperedge;
import org.span.hypergraph.Hypergraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Merges consecutive hyperedges of the same anchor when legal and not cost-increasing.
 * <p>
 * For every anchor the hyperedges it owns are walked in hypergraph order. The head
 * of the walk is merged with its successor when the policy allows it and the merge
 * gain is {@code >= 0}; the merged hyperedge becomes the new head. Otherwise the
 * head is dropped and the walk continues from the successor.
 */
public final class SequentialMergeRefiner implements Refiner {
    private static final Logger log = LoggerFactory.getLogger(SequentialMergeRefiner.class);

    private final HyperedgeEditPolicy policy;

    public SequentialMergeRefiner(HyperedgeEditPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param random unused; merging is deterministic.
     * @return {@code true} when at least one merge was applied.
     */
    @Override
    public boolean refine(OptimizerState state, SplittableRandom random) {
        Objects.requireNonNull(state, "state");
        Hypergraph hypergraph = state.hypergraph();
        HyperedgeEditor editor = new HyperedgeEditor(state, policy);
        int merges = 0;
        for (int anchor : hypergraph.anchorVertices()) {
            List<Hyperedge> owned = new ArrayList<>();
            for (Hyperedge hyperedge : hypergraph.hyperedges()) {
                if (hyperedge.contains(anchor)) {
                    owned.add(hyperedge);
                }
            }
            while (owned.size() >= 2) {
                Hyperedge merged = editor.mergeIfBeneficial(List.of(owned.get(0), owned.get(1)));
                if (merged != null) {
                    owned.remove(0);
                    owned.set(0, merged);
                    merges++;
                } else {
                    owned.remove(0);
                }
            }
        }
        if (merges > 0) {
            log.debug("Merged {} hyperedge pairs, cost={}", merges, state.totalCost());
        }
        return merges > 0;
    }
}

package org.span.optimizer;

import org.span.hypergraph.Hyperedge;
import org.span.hypergraph.Hypergraph;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Applies structural hyperedge edits to an optimizer state when the policy allows them.
 */
public final class HyperedgeEditor {
    private final OptimizerState state;
    private final HyperedgeEditPolicy policy;

    public HyperedgeEditor(OptimizerState state, HyperedgeEditPolicy policy) {
        this.state = Objects.requireNonNull(state, "state");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Merges when the policy allows it and the cost does not increase.
     * <p>
     * The inputs must be distinct hyperedges of the state with equal weights and
     * no commitment, and their union must hold exactly one anchor without
     * duplicating another hyperedge.
     *
     * @return merged hyperedge, or {@code null} when nothing was applied.
     */
    public Hyperedge mergeIfBeneficial(List<Hyperedge> hyperedges) {
        if (!isMergeable(hyperedges)) {
            return null;
        }
        return state.mergeHyperedge(hyperedges);
    }

    /**
     * Splits when legal and free of commitments, whatever the cost impact.
     *
     * @return the split gain, usually negative.
     * @throws IllegalArgumentException when the policy rejects the split.
     */
    public int split(Hyperedge old, List<Hyperedge> parts) {
        if (!policy.canSplit(old, parts)) {
            throw new IllegalArgumentException("Split of " + old + " into " + parts + " is not permitted");
        }
        int gain = state.splitHyperedgeGain(old, parts);
        state.splitHyperedge(old, parts);
        return gain;
    }

    private boolean isMergeable(List<Hyperedge> hyperedges) {
        if (hyperedges == null || hyperedges.isEmpty()) {
            return false;
        }
        Hypergraph hypergraph = state.hypergraph();
        int weight = hyperedges.get(0).weight();
        Set<Hyperedge> distinct = new HashSet<>();
        for (Hyperedge hyperedge : hyperedges) {
            if (hyperedge.weight() != weight
                    || state.isCommitted(hyperedge)
                    || !hypergraph.containsHyperedge(hyperedge)
                    || !distinct.add(hyperedge)) {
                return false;
            }
        }
        Hyperedge union = Hyperedge.union(hyperedges);
        int anchors = 0;
        for (int i = 0; i < union.vertexCount(); i++) {
            if (hypergraph.isAnchor(union.vertexAt(i))) {
                anchors++;
            }
        }
        if (anchors != 1) {
            return false;
        }
        if (hypergraph.containsHyperedge(union) && !distinct.contains(union)) {
            return false;
        }
        return policy.canMerge(hyperedges) && state.mergeHyperedgeGain(hyperedges) >= 0;
    }
}

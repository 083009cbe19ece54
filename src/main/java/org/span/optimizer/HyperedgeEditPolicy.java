package org.span.optimizer;

import org.span.hypergraph.Hyperedge;

import java.util.List;

/**
 * Legality of structural hyperedge edits, decided outside the optimizer.
 * <p>
 * The optimizer only prices edits and applies them; whether an edit is
 * permitted at all comes from the caller's domain analysis.
 */
public interface HyperedgeEditPolicy {

    boolean canMerge(List<Hyperedge> hyperedges);

    boolean canSplit(Hyperedge old, List<Hyperedge> parts);

    /**
     * Policy allowing every edit.
     */
    static HyperedgeEditPolicy permitAll() {
        return new HyperedgeEditPolicy() {
            @Override
            public boolean canMerge(List<Hyperedge> hyperedges) {
                return true;
            }

            @Override
            public boolean canSplit(Hyperedge old, List<Hyperedge> parts) {
                return true;
            }
        };
    }
}

package org.span.hypergraph;

/**
 * Role of a hypergraph vertex for capacity accounting.
 */
public enum VertexRole {
    /** Consumes one capacity slot on the server it is placed on. */
    ANCHOR,
    /** Placed freely, never counted against server capacity. */
    DEPENDENT
}

package com.stackorder.dag.api;

/**
 * Observability interface for tracing what a {@code Dag} does internally.
 *
 * A listener registered with the graph receives callbacks while nodes and edges
 * are inserted, while validation walks the graph and while an order is produced.
 * Typical uses:
 *
 * - Debugging: recording which edges a set of insertions actually produced.
 * - Auditing: reporting the cycle path to an external sink.
 * - Tests: asserting on the sequence of engine steps.
 *
 * Listeners are notified synchronously on the caller's thread. They must not
 * mutate the graph they observe; the return values of the graph never depend on
 * whether a listener is present.
 */
public interface DagListener {

    /**
     * Called after a value was recorded for a node.
     *
     * @param id The inserted node id.
     */
    void onNodeAdded(String id);

    /**
     * Called when a new forward edge is appended. Not called for an edge that
     * already existed.
     *
     * @param from Source of the edge.
     * @param to   Target of the edge.
     */
    void onEdgeAdded(String from, String to);

    /** Called before a validation pass starts walking the graph. */
    void onValidationStart();

    /**
     * Called when validation finds a cycle, before the error is raised.
     *
     * @param id     The starting node whose walk closed the cycle.
     * @param reason The cycle path, e.g. {@code "A -> B -> A"}.
     */
    void onCycleDetected(String id, String reason);

    /**
     * Called when a validation pass is over.
     *
     * @param acyclic true if no cycle was found.
     */
    void onValidationEnd(boolean acyclic);

    /**
     * Called each time the orderer appends a node to its output.
     *
     * @param id       The appended node.
     * @param position Zero-based position in the produced order.
     */
    void onOrdered(String id, int position);
}

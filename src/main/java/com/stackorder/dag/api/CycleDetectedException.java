package com.stackorder.dag.api;

/**
 * Thrown by validation when the declared ordering constraints contain a cycle.
 *
 * The {@link #reason()} is the path walked from the starting node until the
 * cycle closed, e.g. {@code "A -> B -> C -> A"}. A graph in this state must not
 * be ordered.
 */
public class CycleDetectedException extends DagException {
    private final String reason;

    public CycleDetectedException(String nodeId, String reason) {
        super(nodeId, "cycle detected: checking node id \"" + nodeId + "\": " + reason);
        this.reason = reason;
    }

    /** Human readable path describing the cycle. */
    public String reason() {
        return reason;
    }
}

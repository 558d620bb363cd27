package com.stackorder.dag.api;

/**
 * Base type for the errors a {@code Dag} reports to its caller.
 *
 * All of them are unchecked: they describe bad input or an unsatisfiable set of
 * ordering constraints, and are reported synchronously by the call that detects
 * them. Internal invariant violations are never reported through this type.
 */
public class DagException extends RuntimeException {
    private final String nodeId;

    public DagException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    /** The node id the failing operation was working on. */
    public String nodeId() {
        return nodeId;
    }
}

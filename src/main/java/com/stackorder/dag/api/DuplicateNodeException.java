package com.stackorder.dag.api;

/**
 * Thrown when a value is inserted under an id that already carries one.
 * The graph is left exactly as it was before the call.
 */
public class DuplicateNodeException extends DagException {

    public DuplicateNodeException(String nodeId) {
        super(nodeId, "duplicate node: adding node id \"" + nodeId + "\"");
    }
}

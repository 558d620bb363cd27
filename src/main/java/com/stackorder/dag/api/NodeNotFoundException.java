package com.stackorder.dag.api;

/**
 * Thrown when looking up the value of an id that was never inserted. The id may
 * still be known to the graph as an edge endpoint.
 */
public class NodeNotFoundException extends DagException {

    public NodeNotFoundException(String nodeId) {
        super(nodeId, "node not found: \"" + nodeId + "\"");
    }
}

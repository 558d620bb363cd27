package com.stackorder.dag.io;

import com.stackorder.dag.engine.Dag;

import java.util.List;

/**
 * Result of compiling a {@link DagDefinition}: the graph plus the metadata and
 * the node sequence the definition declared.
 */
public record LoadedDag(String name, String version, Dag<NodeSpec> dag, List<String> declaredOrder) {

    /**
     * Validates the graph.
     *
     * @return this, for chaining.
     * @throws com.stackorder.dag.api.CycleDetectedException if the definition
     *                                                       contains a cycle.
     */
    public LoadedDag validated() {
        dag.validate();
        return this;
    }
}

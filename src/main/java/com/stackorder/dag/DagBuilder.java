package com.stackorder.dag;

import com.stackorder.dag.api.DagListener;
import com.stackorder.dag.engine.Dag;

import java.util.Collection;
import java.util.List;

/**
 * Dag Builder: fluent construction API.
 *
 * <p>
 * Collects nodes and their ordering hints, then hands back a validated
 * {@link Dag}:
 *
 * <pre>{@code
 * Dag<Stack> dag = DagBuilder.<Stack>create()
 *         .node("network", network)
 *         .node("vpc", vpc, List.of(), List.of("network"))
 *         .node("app", app, List.of(), List.of("vpc"))
 *         .build();
 * List<String> order = dag.order(); // [network, vpc, app]
 * }</pre>
 *
 * <p>
 * The builder is stateful and not thread-safe. Once {@link #build()} is called
 * the builder is invalidated and cannot be used to add more nodes.
 *
 * @param <V> The node value type.
 */
public final class DagBuilder<V> {
    private final Dag<V> dag = new Dag<>();

    // Flag to prevent modification after building
    private boolean built;

    private DagBuilder() {
    }

    public static <V> DagBuilder<V> create() {
        return new DagBuilder<>();
    }

    /** Registers a listener before any node is inserted. */
    public DagBuilder<V> listener(DagListener listener) {
        checkNotBuilt();
        dag.setListener(listener);
        return this;
    }

    /**
     * Adds a node without ordering hints.
     *
     * @throws com.stackorder.dag.api.DuplicateNodeException if the id already has a value.
     */
    public DagBuilder<V> node(String id, V value) {
        return node(id, value, List.of(), List.of());
    }

    /**
     * Adds a node with ordering hints.
     *
     * @param before Ids that get an edge towards this node.
     * @param after  Ids this node gets an edge towards.
     */
    public DagBuilder<V> node(String id, V value, Collection<String> before, Collection<String> after) {
        checkNotBuilt();
        dag.addNode(id, value, before, after);
        return this;
    }

    /**
     * Compiles the graph.
     *
     * @return The validated graph.
     * @throws com.stackorder.dag.api.CycleDetectedException if the hints form a cycle.
     */
    public Dag<V> build() {
        Dag<V> result = buildUnchecked();
        result.validate();
        return result;
    }

    /** Returns the graph without validating it. */
    public Dag<V> buildUnchecked() {
        checkNotBuilt();
        built = true;
        return dag;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("DagBuilder already built");
    }
}

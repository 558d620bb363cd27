package com.stackorder.dag.engine;

import com.stackorder.dag.api.*;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A Directed Acyclic Graph of string ids carrying values of type {@code V}.
 *
 * The graph stores three things:
 * - Adjacency: for every known id, the ordered list of its forward edges
 * (children). Duplicate targets are suppressed, otherwise insertion order is
 * kept.
 * - Values: the payload of every explicitly inserted id. An id can be known as
 * an edge endpoint without having a value.
 * - Validation cache: the cycle set and the validated flag written by the last
 * {@link #validate()} pass. Every insertion invalidates it.
 *
 * Edge direction:
 * A "before" hint {@code p} on node {@code id} creates the edge
 * {@code p -> id}; an "after" hint {@code s} creates {@code id -> s}.
 * {@link #order()} emits children before their parents, so a node is ordered
 * before the ids of its "before" hints and after the ids of its "after" hints.
 *
 * Thread Safety:
 * Not thread-safe. One owner mutates the graph; readers assume no insertion is
 * running. Callers that need several producers serialise them externally, for
 * instance through {@code DagPipeline}.
 *
 * @param <V> The type of value attached to nodes.
 */
public final class Dag<V> {
    private static final Logger log = LogManager.getLogger(Dag.class);

    // id -> forward edges
    private final Map<String, List<String>> edges = new HashMap<>();
    // id -> value, only for explicitly inserted ids
    private final Map<String, V> values = new HashMap<>();

    // Written by CycleValidator only.
    private Map<String, Boolean> cycles = new HashMap<>();
    private boolean validated;

    private DagListener listener;

    public void setListener(DagListener listener) {
        this.listener = listener;
    }

    DagListener listener() {
        return listener;
    }

    /** Inserts a node without ordering hints. */
    public void addNode(String id, V value) {
        addNode(id, value, null, null);
    }

    /**
     * Inserts a node with its ordering hints.
     *
     * @param id     The node id.
     * @param value  Value attached to the node (may be null).
     * @param before Ids that get an edge towards {@code id}. Null means none.
     * @param after  Ids that {@code id} gets an edge towards. Null means none.
     * @throws DuplicateNodeException if {@code id} already has a value. Nothing
     *                                is written in that case.
     */
    public void addNode(String id, V value, Collection<String> before, Collection<String> after) {
        Objects.requireNonNull(id, "id");
        if (values.containsKey(id))
            throw new DuplicateNodeException(id);
        requireIds(before, "before");
        requireIds(after, "after");

        if (before != null) {
            for (String from : before) {
                edges.computeIfAbsent(from, k -> new ArrayList<>());
                addEdge(from, id);
            }
        }

        edges.computeIfAbsent(id, k -> new ArrayList<>());

        if (after != null) {
            for (String to : after) {
                edges.computeIfAbsent(to, k -> new ArrayList<>());
                addEdge(id, to);
            }
        }

        values.put(id, value);
        validated = false;

        if (listener != null)
            listener.onNodeAdded(id);
    }

    private static void requireIds(Collection<String> ids, String hint) {
        if (ids == null)
            return;
        for (String id : ids)
            if (id == null)
                throw new IllegalArgumentException("Null id in " + hint + " hints");
    }

    private void addEdge(String from, String to) {
        List<String> fromEdges = edges.get(from);
        if (fromEdges == null)
            throw new IllegalStateException("internal error: edge list of " + from + " must exist at this point");

        if (fromEdges.contains(to))
            return;

        log.trace("Add edge {} -> {}", from, to);
        fromEdges.add(to);
        if (listener != null)
            listener.onEdgeAdded(from, to);
    }

    /**
     * Returns the value of the node.
     *
     * @throws NodeNotFoundException if {@code id} was never inserted with a value.
     */
    public V node(String id) {
        if (!values.containsKey(id))
            throw new NodeNotFoundException(id);
        return values.get(id);
    }

    /** Returns the forward edges of {@code id}, empty for unknown ids. */
    public List<String> childrenOf(String id) {
        List<String> children = edges.get(id);
        return children == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(children));
    }

    /** Returns every known id, inserted or referenced, in ascending order. */
    public List<String> ids() {
        return sorted(edges.keySet());
    }

    /** true if the id was inserted or referenced by an edge. */
    public boolean contains(String id) {
        return edges.containsKey(id);
    }

    /** true if the id was inserted with a value. */
    public boolean hasValue(String id) {
        return values.containsKey(id);
    }

    public int size() {
        return edges.size();
    }

    public boolean isValidated() {
        return validated;
    }

    /**
     * Looks for cycles.
     *
     * The result is cached until the next insertion, including a failed result.
     *
     * @throws CycleDetectedException on the first cycle found, walking start ids
     *                                in ascending order.
     */
    public void validate() {
        new CycleValidator(this).validate();
    }

    /**
     * Same as {@link #validate()} but reports the cycle path instead of throwing.
     *
     * @return The cycle path, or an empty string if the graph is acyclic.
     */
    public String validateQuietly() {
        try {
            validate();
            return "";
        } catch (CycleDetectedException e) {
            return e.reason();
        }
    }

    /**
     * Tells whether {@code id} took part in the cycle found by validation.
     *
     * Runs a full validation first if the graph changed since the last one.
     * Never throws; a node unknown to the graph is reported as false.
     */
    public boolean hasCycle(String id) {
        if (!validated) {
            log.trace("hasCycle({}) triggers validation", id);
            if (validateQuietly().isEmpty())
                return false;
        }
        return cycles.getOrDefault(id, Boolean.FALSE);
    }

    /**
     * Ids flagged by the last validation pass, ascending. Empty if the graph was
     * never validated or the last pass found no cycle.
     */
    public List<String> cycleMembers() {
        List<String> members = new ArrayList<>();
        for (var entry : cycles.entrySet())
            if (entry.getValue())
                members.add(entry.getKey());
        Collections.sort(members);
        return members;
    }

    /**
     * Returns all ids so that every node comes after all nodes reachable from it.
     * Ties are broken by ascending id.
     *
     * @throws IllegalStateException if the graph contains a cycle. Validate
     *                               before ordering.
     */
    public List<String> order() {
        return new DagOrderer(this).order();
    }

    // ── Validation cache, owned by CycleValidator ────────────────

    void resetCycles() {
        cycles = new HashMap<>();
        validated = true;
    }

    void markCycle(String id) {
        cycles.put(id, Boolean.TRUE);
    }

    /** Raw edge list for the engine's walkers; null for unknown ids. */
    List<String> edgesOf(String id) {
        return edges.get(id);
    }

    static List<String> sorted(Collection<String> ids) {
        List<String> list = new ArrayList<>(ids);
        Collections.sort(list);
        return list;
    }
}

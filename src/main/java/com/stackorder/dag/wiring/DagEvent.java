package com.stackorder.dag.wiring;

import java.util.List;

/**
 * A mutable insertion command, used within the LMAX Disruptor RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated during RingBuffer
 * construction and reused for every published command.
 *
 * <p>
 * <b>Fields:</b>
 * <ul>
 * <li>{@code id}: The node to insert, null for a bare batch marker.</li>
 * <li>{@code value}: The value attached to the node.</li>
 * <li>{@code before}/{@code after}: Ordering hints.</li>
 * <li>{@code batchEnd}: Forces validation and a batch report after this
 * event.</li>
 * </ul>
 *
 * @param <V> The node value type.
 */
public final class DagEvent<V> {
    private String id;
    private V value;
    private List<String> before = List.of();
    private List<String> after = List.of();
    private boolean batchEnd;
    private long sequenceId;

    /**
     * Configures the event as a node insertion.
     *
     * @param id       Node id.
     * @param value    Node value.
     * @param before   Ids that must get an edge towards the node.
     * @param after    Ids the node gets an edge towards.
     * @param batchEnd If true, forces a batch report after this event.
     * @param seqId    The sequence ID (for correlation/logging).
     */
    public void setInsert(String id, V value, List<String> before, List<String> after,
            boolean batchEnd, long seqId) {
        List<String> beforeIds = before == null ? List.of() : List.copyOf(before);
        List<String> afterIds = after == null ? List.of() : List.copyOf(after);
        this.id = id;
        this.value = value;
        this.before = beforeIds;
        this.after = afterIds;
        this.batchEnd = batchEnd;
        this.sequenceId = seqId;
    }

    /** Configures the event as a batch marker carrying no insertion. */
    public void setBatchMarker(long seqId) {
        clear();
        this.batchEnd = true;
        this.sequenceId = seqId;
    }

    public String id() {
        return id;
    }

    public V value() {
        return value;
    }

    public List<String> before() {
        return before;
    }

    public List<String> after() {
        return after;
    }

    public boolean isInsert() {
        return id != null;
    }

    public boolean isBatchEnd() {
        return batchEnd;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        id = null;
        value = null;
        before = List.of();
        after = List.of();
        batchEnd = false;
        sequenceId = 0;
    }
}

package com.stackorder.dag.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.stackorder.dag.engine.Dag;

import java.util.List;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Serialises insertions from any number of threads onto a single owner of a
 * {@link Dag}, using the LMAX Disruptor.
 *
 * <p>
 * Producer threads call {@link #insert}; a dedicated daemon consumer thread
 * applies the insertions through a {@link DagPublisher} and reports each batch
 * to the callback. {@link #close()} drains pending events and stops the
 * consumer, after which {@link #dag()} may be read from the calling thread.
 *
 * @param <V> The node value type.
 */
@Log4j2
public final class DagPipeline<V> implements AutoCloseable {
    private static final int DEFAULT_RING_BUFFER_SIZE = 1024;

    private final DagPublisher<V> publisher;
    private final Disruptor<DagEvent<V>> disruptor;
    private final RingBuffer<DagEvent<V>> ringBuffer;
    private volatile boolean closed;

    public DagPipeline(DagPublisher.BatchCallback callback) {
        this(new Dag<>(), callback, DEFAULT_RING_BUFFER_SIZE);
    }

    /**
     * @param dag            The graph to own. Must not be touched by other threads
     *                       until the pipeline is closed.
     * @param callback       Batch callback, may be null.
     * @param ringBufferSize Power of two.
     */
    public DagPipeline(Dag<V> dag, DagPublisher.BatchCallback callback, int ringBufferSize) {
        this.publisher = new DagPublisher<>(dag);
        this.publisher.setBatchCallback(callback);

        this.disruptor = new Disruptor<>(
                DagEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());

        EventHandler<DagEvent<V>> handler = publisher::onEvent;
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.debug("Dag pipeline started with ring buffer of {}", ringBufferSize);
    }

    /** Requests the insertion of a node. Safe to call from any thread. */
    public void insert(String id, V value, List<String> before, List<String> after) {
        insert(id, value, before, after, false);
    }

    /**
     * Requests the insertion of a node.
     *
     * @param batchEnd If true, the graph is validated and reported right after
     *                 this insertion.
     * @throws IllegalArgumentException if a hint list holds a null id. Nothing is
     *                                  published in that case.
     * @throws IllegalStateException    if the pipeline is closed.
     */
    public void insert(String id, V value, List<String> before, List<String> after, boolean batchEnd) {
        Objects.requireNonNull(id, "id");
        List<String> beforeIds = copyHints(before, "before");
        List<String> afterIds = copyHints(after, "after");
        checkOpen();

        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setInsert(id, value, beforeIds, afterIds, batchEnd, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Forces a batch report once all previously published insertions are applied. */
    public void flush() {
        checkOpen();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setBatchMarker(sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void checkOpen() {
        if (closed)
            throw new IllegalStateException("Dag pipeline is closed");
    }

    // The event must not be half-filled once its sequence is claimed.
    private static List<String> copyHints(List<String> ids, String hint) {
        if (ids == null)
            return List.of();
        for (String id : ids)
            if (id == null)
                throw new IllegalArgumentException("Null id in " + hint + " hints");
        return List.copyOf(ids);
    }

    /** The owned graph. Only safe to read once the pipeline is closed. */
    public Dag<V> dag() {
        return publisher.dag();
    }

    /** Drains pending insertions and stops the consumer thread. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
        log.debug("Dag pipeline stopped");
    }
}

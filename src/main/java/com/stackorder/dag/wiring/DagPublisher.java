package com.stackorder.dag.wiring;

import com.stackorder.dag.api.DagException;
import com.stackorder.dag.engine.Dag;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor event handler that applies {@link DagEvent}s to the graph it owns.
 *
 * This class is the single owner of its {@link Dag}: it is meant to run on the
 * one consumer thread of a ring buffer, so any number of producer threads can
 * request insertions while the graph itself stays single-threaded.
 *
 * Batching:
 * The Disruptor sets 'endOfBatch' when no more events are immediately
 * available. Insertions are applied one by one, but the graph is validated and
 * ordered only when a batch ends (or an event explicitly requests it), and the
 * outcome is handed to the {@link BatchCallback}.
 *
 * Errors:
 * A rejected insertion (e.g. a duplicate id) is logged and reported in the next
 * {@link BatchResult}; it never stops the consumer thread.
 *
 * @param <V> The node value type.
 */
public final class DagPublisher<V> {
    private static final Logger log = LogManager.getLogger(DagPublisher.class);

    private final Dag<V> dag;
    private BatchCallback batchCallback;

    private int inserted;
    private final List<String> rejected = new ArrayList<>();

    public DagPublisher(Dag<V> dag) {
        this.dag = dag;
    }

    /** The owned graph. Read it only from the consumer thread or once the pipeline is stopped. */
    public Dag<V> dag() {
        return dag;
    }

    public void setBatchCallback(BatchCallback cb) {
        this.batchCallback = cb;
    }

    /**
     * Process a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence ID of the event.
     * @param endOfBatch Flag indicating if this is the last event in the current
     *                   batch.
     */
    public void onEvent(DagEvent<V> event, long sequence, boolean endOfBatch) {
        boolean reportNow = event.isBatchEnd() || endOfBatch;

        if (event.isInsert()) {
            try {
                dag.addNode(event.id(), event.value(), event.before(), event.after());
                inserted++;
            } catch (DagException | IllegalArgumentException e) {
                log.error("Rejected insert of node {} (seq={}): {}", event.id(), event.sequenceId(), e.getMessage());
                rejected.add(e.getMessage());
            }
        }
        event.clear();

        if (reportNow)
            endBatch(sequence);
    }

    private void endBatch(long sequence) {
        String reason = dag.validateQuietly();
        List<String> order = reason.isEmpty() ? dag.order() : List.of();
        if (!reason.isEmpty())
            log.warn("Batch ending at seq {} left the dag with a cycle: {}", sequence, reason);

        BatchResult result = new BatchResult(sequence, inserted, List.copyOf(rejected), List.copyOf(order), reason);
        inserted = 0;
        rejected.clear();

        if (batchCallback == null)
            return;
        try {
            batchCallback.onBatch(result);
        } catch (RuntimeException e) {
            // Keep the consumer thread alive.
            log.error("Batch callback failed at seq {}: {}", sequence, e.getMessage(), e);
        }
    }

    /**
     * Callback interface for post-batch actions.
     */
    @FunctionalInterface
    public interface BatchCallback {
        /**
         * Called on the consumer thread after a batch was applied and validated.
         *
         * @param result Outcome of the batch.
         */
        void onBatch(BatchResult result);
    }
}

package com.stackorder.dag.wiring;

import java.util.List;

/**
 * What a {@link DagPublisher} reports at the end of a batch.
 *
 * @param sequence    Ring buffer sequence of the event that closed the batch.
 * @param inserted    Number of nodes inserted during the batch.
 * @param rejected    Messages of the insertions rejected during the batch.
 * @param order       Order of the whole graph, empty when a cycle was found.
 * @param cycleReason Cycle path, empty when the graph is acyclic.
 */
public record BatchResult(long sequence, int inserted, List<String> rejected, List<String> order,
        String cycleReason) {

    public boolean acyclic() {
        return cycleReason.isEmpty();
    }
}

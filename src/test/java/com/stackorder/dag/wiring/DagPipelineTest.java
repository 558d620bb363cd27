package com.stackorder.dag.wiring;

import com.stackorder.dag.engine.Dag;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class DagPipelineTest {

    @Test
    public void testFlushReportsAllInsertions() throws Exception {
        List<BatchResult> results = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(1);

        try (DagPipeline<Integer> pipeline = new DagPipeline<>(result -> {
            results.add(result);
            if (result.order().size() == 3)
                done.countDown();
        })) {
            pipeline.insert("app", 1, null, List.of("vpc"));
            pipeline.insert("vpc", 2, null, List.of("network"));
            pipeline.insert("network", 3, null, null);
            pipeline.flush();

            assertTrue("batch report not received", done.await(5, TimeUnit.SECONDS));
        }

        BatchResult last = results.get(results.size() - 1);
        assertEquals(List.of("network", "vpc", "app"), last.order());
        int inserted = 0;
        for (BatchResult r : results)
            inserted += r.inserted();
        assertEquals(3, inserted);
    }

    @Test
    public void testConcurrentProducersSerialised() throws Exception {
        int producers = 4;
        int perProducer = 250;
        Dag<String> dag = new Dag<>();

        try (DagPipeline<String> pipeline = new DagPipeline<>(dag, null, 256)) {
            List<Thread> threads = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                final int producer = p;
                Thread t = new Thread(() -> {
                    for (int i = 0; i < perProducer; i++) {
                        String id = String.format("p%d-%04d", producer, i);
                        List<String> after = i == 0 ? null : List.of(String.format("p%d-%04d", producer, i - 1));
                        pipeline.insert(id, id, null, after);
                    }
                });
                threads.add(t);
                t.start();
            }
            for (Thread t : threads)
                t.join();
        }

        // close() drained the ring buffer
        assertEquals(producers * perProducer, dag.size());
        assertEquals("", dag.validateQuietly());
        List<String> order = dag.order();
        assertEquals("p0-0000", order.get(0));
        assertTrue(order.indexOf("p3-0100") > order.indexOf("p3-0099"));
    }

    @Test
    public void testCloseIsIdempotent() {
        DagPipeline<String> pipeline = new DagPipeline<>(null);
        pipeline.insert("A", "a", null, null, true);
        pipeline.close();
        pipeline.close();
        assertEquals("a", pipeline.dag().node("A"));
    }

    @Test
    public void testNullHintRejectedBeforePublishing() {
        DagPipeline<String> pipeline = new DagPipeline<>(null);
        try {
            pipeline.insert("A", "a", Arrays.asList("P", null), List.of("B"));
            fail("Should have thrown IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("before"));
        }
        pipeline.insert("C", "c", null, null, true);
        pipeline.close();

        Dag<String> dag = pipeline.dag();
        assertFalse(dag.contains("A"));
        assertFalse(dag.contains("P"));
        assertFalse(dag.contains("B"));
        assertEquals(List.of("C"), dag.ids());
    }

    @Test
    public void testInsertAfterCloseFails() {
        DagPipeline<String> pipeline = new DagPipeline<>(null);
        pipeline.close();

        try {
            pipeline.insert("A", "a", null, null);
            fail("Should have thrown IllegalStateException");
        } catch (IllegalStateException expected) {
            // closed
        }
        try {
            pipeline.flush();
            fail("Should have thrown IllegalStateException");
        } catch (IllegalStateException expected) {
            // closed
        }
        assertEquals(0, pipeline.dag().size());
    }
}

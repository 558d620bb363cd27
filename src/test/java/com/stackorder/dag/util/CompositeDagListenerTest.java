package com.stackorder.dag.util;

import com.stackorder.dag.api.DagListener;
import com.stackorder.dag.engine.Dag;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CompositeDagListenerTest {

    // Prefixes every callback with a tag so fan-out order is visible.
    private static DagListener tagged(String tag, List<String> log) {
        return new DagListener() {
            @Override
            public void onNodeAdded(String id) {
                log.add(tag + ":node:" + id);
            }

            @Override
            public void onEdgeAdded(String from, String to) {
                log.add(tag + ":edge:" + from + "->" + to);
            }

            @Override
            public void onValidationStart() {
                log.add(tag + ":start");
            }

            @Override
            public void onCycleDetected(String id, String reason) {
                log.add(tag + ":cycle:" + reason);
            }

            @Override
            public void onValidationEnd(boolean acyclic) {
                log.add(tag + ":end:" + acyclic);
            }

            @Override
            public void onOrdered(String id, int position) {
                log.add(tag + ":ordered:" + id);
            }
        };
    }

    @Test
    public void testFanOutInRegistrationOrder() {
        List<String> log = new ArrayList<>();
        CompositeDagListener composite = new CompositeDagListener()
                .add(tagged("first", log))
                .add(tagged("second", log));
        assertEquals(2, composite.size());

        Dag<String> dag = new Dag<>();
        dag.setListener(composite);
        dag.addNode("A", "a", null, List.of("B"));

        assertEquals(List.of(
                "first:edge:A->B", "second:edge:A->B",
                "first:node:A", "second:node:A"), log);

        log.clear();
        dag.validate();
        dag.order();
        assertEquals(List.of(
                "first:start", "second:start",
                "first:end:true", "second:end:true",
                "first:ordered:B", "second:ordered:B",
                "first:ordered:A", "second:ordered:A"), log);
    }

    @Test
    public void testEmptyCompositeIsHarmless() {
        Dag<String> dag = new Dag<>();
        dag.setListener(new CompositeDagListener());
        dag.addNode("A", "a", null, List.of("A"));
        assertEquals("A -> A", dag.validateQuietly());
    }
}

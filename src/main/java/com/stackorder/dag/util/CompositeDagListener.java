package com.stackorder.dag.util;

import com.stackorder.dag.api.DagListener;
import java.util.Arrays;

/**
 * Fans {@link DagListener} callbacks out to several listeners, in registration
 * order.
 */
public class CompositeDagListener implements DagListener {
    private DagListener[] listeners = new DagListener[0];

    public CompositeDagListener add(DagListener listener) {
        DagListener[] old = listeners;
        DagListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onNodeAdded(String id) {
        for (DagListener l : listeners)
            l.onNodeAdded(id);
    }

    @Override
    public void onEdgeAdded(String from, String to) {
        for (DagListener l : listeners)
            l.onEdgeAdded(from, to);
    }

    @Override
    public void onValidationStart() {
        for (DagListener l : listeners)
            l.onValidationStart();
    }

    @Override
    public void onCycleDetected(String id, String reason) {
        for (DagListener l : listeners)
            l.onCycleDetected(id, reason);
    }

    @Override
    public void onValidationEnd(boolean acyclic) {
        for (DagListener l : listeners)
            l.onValidationEnd(acyclic);
    }

    @Override
    public void onOrdered(String id, int position) {
        for (DagListener l : listeners)
            l.onOrdered(id, position);
    }
}

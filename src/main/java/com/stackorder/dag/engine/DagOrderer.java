package com.stackorder.dag.engine;

import com.stackorder.dag.api.DagListener;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Deterministic depth-first ordering of a {@link Dag}.
 *
 * Start ids are taken in ascending order, skipping those already emitted. From
 * each start id the walk descends into the children in ascending order and
 * appends a node only once all of its children are appended. The output
 * therefore lists every node after everything reachable from it.
 *
 * The walk uses an explicit stack of frames instead of recursion, so the depth
 * of the graph is limited by heap, not by the thread stack. Nodes on the
 * current path are tracked; meeting one again means the graph has a cycle,
 * which is a precondition violation for ordering.
 */
@Log4j2
final class DagOrderer {
    private final Dag<?> dag;
    private final DagListener listener;

    private final List<String> order = new ArrayList<>();
    private final Set<String> visited = new HashSet<>();

    DagOrderer(Dag<?> dag) {
        this.dag = dag;
        this.listener = dag.listener();
    }

    List<String> order() {
        for (String id : dag.ids()) {
            if (visited.contains(id))
                continue;
            log.trace("Walk from {}", id);
            walkFrom(id);
        }
        return order;
    }

    private void walkFrom(String start) {
        Deque<Frame> stack = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        stack.push(frame(start));
        onPath.add(start);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next < top.children.size()) {
                String child = top.children.get(top.next++);
                if (visited.contains(child))
                    continue;
                if (onPath.contains(child))
                    throw new IllegalStateException("Cannot order a graph with a cycle: " + top.id + " -> " + child
                            + " closes a loop. Validate the graph before ordering it.");
                stack.push(frame(child));
                onPath.add(child);
                continue;
            }

            stack.pop();
            onPath.remove(top.id);
            if (visited.add(top.id)) {
                log.trace("Append {} to order", top.id);
                order.add(top.id);
                if (listener != null)
                    listener.onOrdered(top.id, order.size() - 1);
            }
        }
    }

    private Frame frame(String id) {
        List<String> children = dag.edgesOf(id);
        if (children == null)
            throw new IllegalStateException("internal error: no edge list for known id " + id);
        return new Frame(id, Dag.sorted(children));
    }

    // One level of the walk: the node and the position of the next child to visit.
    private static final class Frame {
        final String id;
        final List<String> children;
        int next;

        Frame(String id, List<String> children) {
            this.id = id;
            this.children = children;
        }
    }
}

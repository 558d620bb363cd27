package com.stackorder.dag.engine;

import com.stackorder.dag.api.CycleDetectedException;
import com.stackorder.dag.api.DagListener;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Cycle detection over the adjacency lists of a {@link Dag}.
 *
 * Algorithm:
 * Start ids are taken in ascending order. From each start id a depth-first
 * search walks the children, carrying the current branch (the path from the
 * start id to the frontier).
 *
 * 1. If a branch member is among the frontier's children, the cycle is closed:
 * the members from that id to the frontier, plus the start id, are flagged in
 * the graph's cycle set and the branch, closed by that id, is the description.
 * 2. Otherwise each child is visited in ascending order with the branch
 * extended by that child. The first cycle found stops the walk.
 *
 * A node whose subtree was fully explored without finding a cycle cannot reach
 * a cycle, so it is not explored again within the same pass.
 *
 * The walk uses an explicit stack of frames, like {@link DagOrderer}, so a deep
 * chain is limited by heap and not by the thread stack. The description is
 * built from the branch only once a cycle is found.
 */
@Log4j2
final class CycleValidator {
    private final Dag<?> dag;
    private final Set<String> cleared = new HashSet<>();

    // Current branch, from the start id to the frontier, and each member's index on it.
    private final List<String> branch = new ArrayList<>();
    private final Map<String, Integer> position = new HashMap<>();
    private final Deque<Frame> stack = new ArrayDeque<>();

    CycleValidator(Dag<?> dag) {
        this.dag = dag;
    }

    void validate() {
        final DagListener l = dag.listener();
        dag.resetCycles();
        if (l != null)
            l.onValidationStart();

        for (String id : dag.ids()) {
            log.trace("Validate node {}", id);
            String reason = walkFrom(id);
            if (reason != null) {
                dag.markCycle(id);
                log.debug("Cycle detected from {}: {}", id, reason);
                if (l != null) {
                    l.onCycleDetected(id, reason);
                    l.onValidationEnd(false);
                }
                throw new CycleDetectedException(id, reason);
            }
        }

        if (l != null)
            l.onValidationEnd(true);
    }

    /**
     * @return The completed cycle description, or null if no cycle is reachable
     *         from {@code start}.
     */
    private String walkFrom(String start) {
        branch.clear();
        position.clear();
        stack.clear();

        String found = enter(start);
        while (found == null && !stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next < top.children.size()) {
                String child = top.children.get(top.next++);
                log.trace("Check if {} has cycle", child);
                found = enter(child);
                continue;
            }

            stack.pop();
            branch.remove(branch.size() - 1);
            position.remove(top.id);
            cleared.add(top.id);
        }
        return found;
    }

    /**
     * Puts {@code id} on the branch. If one of its children is already on the
     * branch, the earliest such member closes the cycle.
     *
     * @return The cycle description, or null if the walk goes on.
     */
    private String enter(String id) {
        if (cleared.contains(id))
            return null;

        branch.add(id);
        position.put(id, branch.size() - 1);

        List<String> children = edgesOf(id);
        int closing = -1;
        for (String child : children) {
            Integer at = position.get(child);
            if (at != null && (closing < 0 || at < closing))
                closing = at;
        }

        if (closing >= 0) {
            for (int j = closing; j < branch.size(); j++)
                dag.markCycle(branch.get(j));
            return String.join(" -> ", branch) + " -> " + branch.get(closing);
        }

        stack.push(new Frame(id, Dag.sorted(children)));
        return null;
    }

    private List<String> edgesOf(String id) {
        List<String> children = dag.edgesOf(id);
        if (children == null)
            throw new IllegalStateException("internal error: no edge list for known id " + id);
        return children;
    }

    // One branch level: the node and the position of the next child to visit.
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

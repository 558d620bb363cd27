package com.stackorder.dag.util;

import com.stackorder.dag.engine.Dag;

import java.util.List;

/**
 * Diagnostic utility for inspecting the structure of a {@link Dag}.
 *
 * <p>
 * Produces human-readable dumps of single nodes, of the whole adjacency, and a
 * Mermaid diagram suitable for embedding in Markdown.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and error reports. The dumps
 * read the graph's validation cache as it is and never trigger a validation.
 */
public final class DagExplain {
    private final Dag<?> dag;

    public DagExplain(Dag<?> dag) {
        this.dag = dag;
    }

    /**
     * Dumps what the graph knows about a single node.
     */
    public String explainNode(String id) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id).append('\n')
                .append("  Known: ").append(dag.contains(id)).append('\n')
                .append("  Has value: ").append(dag.hasValue(id)).append('\n');
        if (dag.hasValue(id))
            sb.append("  Value: ").append(dag.node(id)).append('\n');
        if (dag.isValidated())
            sb.append("  In cycle: ").append(dag.cycleMembers().contains(id)).append('\n');
        List<String> children = dag.childrenOf(id);
        sb.append("  Children (").append(children.size()).append("): ")
                .append(String.join(", ", children));
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire adjacency, one node per line in ascending id order.
     */
    public String dumpTopology() {
        List<String> ids = dag.ids();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Dag (").append(ids.size()).append(" nodes):\n");
        for (String id : ids) {
            sb.append("  ").append(id);
            if (!dag.hasValue(id))
                sb.append(" (ref)");
            List<String> children = dag.childrenOf(id);
            if (!children.isEmpty())
                sb.append(" -> ").append(String.join(", ", children));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Nodes flagged by the last validation pass get the {@code cycle} class.
     * </p>
     */
    public String toMermaid() {
        List<String> ids = dag.ids();
        List<String> cycleMembers = dag.cycleMembers();
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes
        for (String id : ids) {
            sb.append("  ").append(sanitize(id)).append("[\"").append(id).append("\"]");
            if (cycleMembers.contains(id))
                sb.append(":::cycle");
            sb.append(";\n");
        }

        // 2. Declare edges afterwards, in insertion order per node
        for (String id : ids) {
            for (String child : dag.childrenOf(id))
                sb.append("  ").append(sanitize(id)).append(" --> ").append(sanitize(child)).append(";\n");
        }

        if (!cycleMembers.isEmpty())
            sb.append("  classDef cycle stroke:#d33,stroke-width:2px;\n");
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}

package com.stackorder.dag.util;

import com.stackorder.dag.engine.Dag;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DagExplainTest {

    @Test
    public void testDumpTopology() {
        Dag<String> dag = new Dag<>();
        dag.addNode("A", "a", null, List.of("B", "C"));
        dag.addNode("C", "c");

        String dump = new DagExplain(dag).dumpTopology();

        assertEquals("Dag (3 nodes):\n"
                + "  A -> B, C\n"
                + "  B (ref)\n"
                + "  C\n", dump);
    }

    @Test
    public void testExplainNode() {
        Dag<String> dag = new Dag<>();
        dag.addNode("A", "payload", null, List.of("B"));

        String text = new DagExplain(dag).explainNode("A");
        assertTrue(text.contains("Node: A"));
        assertTrue(text.contains("Value: payload"));
        assertTrue(text.contains("Children (1): B"));
        assertFalse(text.contains("In cycle"));

        String ref = new DagExplain(dag).explainNode("B");
        assertTrue(ref.contains("Has value: false"));
        assertFalse(ref.contains("Value: "));
    }

    @Test
    public void testMermaidMarksCycle() {
        Dag<String> dag = new Dag<>();
        dag.addNode("a-1", "x", null, List.of("b"));
        dag.addNode("b", "y", null, List.of("a-1"));
        dag.addNode("c", "z");
        dag.validateQuietly();

        String mermaid = new DagExplain(dag).toMermaid();

        assertTrue(mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid.contains("  a_1[\"a-1\"]:::cycle;\n"));
        assertTrue(mermaid.contains("  b[\"b\"]:::cycle;\n"));
        assertTrue(mermaid.contains("  c[\"c\"];\n"));
        assertTrue(mermaid.contains("  a_1 --> b;\n"));
        assertTrue(mermaid.contains("  b --> a_1;\n"));
        assertTrue(mermaid.contains("classDef cycle"));
    }

    @Test
    public void testExplainDoesNotValidate() {
        Dag<String> dag = new Dag<>();
        dag.addNode("A", "a", null, List.of("A"));

        new DagExplain(dag).toMermaid();
        new DagExplain(dag).explainNode("A");
        assertFalse(dag.isValidated());
    }
}

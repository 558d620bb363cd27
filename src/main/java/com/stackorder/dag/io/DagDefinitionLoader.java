package com.stackorder.dag.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stackorder.dag.engine.Dag;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads JSON DAG definitions and compiles them into a {@link Dag}.
 *
 * <p>
 * Expected layout:
 *
 * <pre>{@code
 * { "dag": { "name": "stacks", "version": "1",
 *            "nodes": [ { "id": "vpc", "after": ["network"],
 *                         "description": "...", "properties": { } } ] } }
 * }</pre>
 *
 * <p>
 * Nodes are inserted in the order they are declared. Compiling does not
 * validate; call {@link LoadedDag#validated()} before ordering.
 */
public final class DagDefinitionLoader {
    private static final Logger log = LogManager.getLogger(DagDefinitionLoader.class);

    private final ObjectMapper mapper;

    public DagDefinitionLoader() {
        this(new ObjectMapper());
    }

    public DagDefinitionLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Parses a JSON file into a DagDefinition. */
    public DagDefinition parseFile(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load dag definition from " + path, e);
        }
    }

    /** Parses a JSON string into a DagDefinition. */
    public DagDefinition parse(String json) {
        DagDefinition def;
        try {
            def = mapper.readValue(json, DagDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed dag definition: " + e.getOriginalMessage(), e);
        }
        if (def == null || def.getDag() == null)
            throw new IllegalArgumentException("Missing 'dag' key");
        return def;
    }

    /** Parses and compiles a JSON file. */
    public LoadedDag load(Path path) {
        LoadedDag loaded = compile(parseFile(path));
        log.info("Loaded dag '{}' ({} nodes) from {}", loaded.name(), loaded.dag().size(), path);
        return loaded;
    }

    /**
     * Compiles the definition into a graph.
     *
     * @throws IllegalArgumentException                        if a node has no id.
     * @throws com.stackorder.dag.api.DuplicateNodeException if two nodes share an id.
     */
    public LoadedDag compile(DagDefinition def) {
        DagDefinition.DagInfo info = def.getDag();
        Dag<NodeSpec> dag = new Dag<>();
        List<String> declared = new ArrayList<>();

        if (info.getNodes() != null) {
            for (DagDefinition.NodeDef nd : info.getNodes()) {
                if (nd.getId() == null || nd.getId().isEmpty())
                    throw new IllegalArgumentException("Node without id in dag " + info.getName());
                dag.addNode(nd.getId(), new NodeSpec(nd.getDescription(), nd.getProperties()),
                        nd.getBefore(), nd.getAfter());
                declared.add(nd.getId());
            }
        }

        log.debug("Compiled dag '{}' version {}: {} declared, {} known", info.getName(), info.getVersion(),
                declared.size(), dag.size());
        return new LoadedDag(info.getName(), info.getVersion(), dag, Collections.unmodifiableList(declared));
    }
}

package com.stackorder.dag.io;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value attached to nodes loaded from a {@link DagDefinition}.
 *
 * @param description Free text from the definition, may be null.
 * @param properties  Arbitrary properties, never null. JSON nulls are kept.
 */
public record NodeSpec(String description, Map<String, Object> properties) {
    public NodeSpec {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}

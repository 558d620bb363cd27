package com.stackorder.dag.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a DAG definition file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DagDefinition {
    private DagInfo dag;

    /** Meta-information about the graph and its nodes. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class DagInfo {
        private String name, version;
        private List<NodeDef> nodes;
    }

    /** Definition of a single node and its ordering hints. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String id, description;
        private List<String> before;
        private List<String> after;
        private Map<String, Object> properties;
    }
}

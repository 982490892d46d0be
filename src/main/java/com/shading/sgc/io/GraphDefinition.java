package com.shading.sgc.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a saved shader graph.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information about the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name, version;
        /** Compiler options, see {@code CompilerOptions.fromProperties}. */
        private Map<String, Object> options;
        private List<NodeDef> nodes;
    }

    /**
     * Definition of a single node.
     * <p>
     * {@code inputs} maps an input pin to {@code "producer.Pin"}, or to
     * {@code "producer"} for the producer's first output pin.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description;
        private Map<String, String> inputs;
        private Map<String, Object> properties;
    }
}

package com.shading.sgc.io;

import com.shading.sgc.compile.CompilerOptions;
import com.shading.sgc.model.ShaderGraph;

import java.util.Map;

/**
 * A graph built from a {@link GraphDefinition}.
 *
 * @param name    graph name.
 * @param version graph version.
 * @param graph   the live graph.
 * @param nodeIds node ids keyed by definition name.
 * @param options compiler options declared by the definition, defaults otherwise.
 */
public record LoadedGraph(String name, String version, ShaderGraph graph, Map<String, Integer> nodeIds,
        CompilerOptions options) {

    /**
     * @throws IllegalArgumentException if the definition had no such node.
     */
    public int nodeId(String nodeName) {
        Integer id = nodeIds.get(nodeName);
        if (id == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        return id;
    }
}

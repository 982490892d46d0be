package com.shading.sgc.io;

import com.shading.sgc.compile.CompilerOptions;
import com.shading.sgc.model.NodeKind;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds a live {@link ShaderGraph} from a {@link GraphDefinition}.
 *
 * All nodes are created first and linked afterwards, so the order of the
 * definition does not matter and cyclic definitions load fine (the compiler
 * breaks the cycle).
 */
public final class GraphDefinitionLoader {
    private static final Logger log = LogManager.getLogger(GraphDefinitionLoader.class);

    private GraphDefinitionLoader() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException on unknown types, duplicate or unknown
     *                                  node names, unknown pins or properties.
     * @throws IllegalStateException    if the definition has two output nodes.
     */
    public static LoadedGraph load(GraphDefinition def) {
        GraphDefinition.GraphInfo info = def.getGraph();
        if (info == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        List<GraphDefinition.NodeDef> nodeDefs = info.getNodes() != null ? info.getNodes() : List.of();

        ShaderGraph graph = new ShaderGraph();
        Map<String, Integer> ids = new LinkedHashMap<>();

        // 1. Instantiate every node
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node without a name in graph " + info.getName());
            if (ids.containsKey(nd.getName()))
                throw new IllegalArgumentException("Duplicate node name: " + nd.getName());
            NodeKind kind = NodeKind.fromString(nd.getType());
            Map<String, Object> props = nd.getProperties() != null ? nd.getProperties() : Collections.emptyMap();
            ShaderNode node;
            try {
                node = graph.addNode(kind, props);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Node '" + nd.getName() + "': " + e.getMessage(), e);
            }
            ids.put(nd.getName(), node.id());
        }

        // 2. Wire inputs
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            if (nd.getInputs() == null)
                continue;
            int consumer = ids.get(nd.getName());
            for (Map.Entry<String, String> e : nd.getInputs().entrySet()) {
                PinRef producer = resolve(graph, ids, e.getValue(), nd.getName());
                try {
                    graph.connect(producer.nodeId(), producer.pin(), consumer, e.getKey());
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("Node '" + nd.getName() + "' input '" + e.getKey() + "': "
                            + ex.getMessage(), ex);
                }
            }
        }

        log.debug("Loaded graph '{}' v{}: {} nodes, {} links", info.getName(), info.getVersion(),
                graph.nodeCount(), graph.links().size());
        return new LoadedGraph(info.getName(), info.getVersion(), graph, Collections.unmodifiableMap(ids),
                CompilerOptions.fromProperties(info.getOptions()));
    }

    /** Parses and loads a classpath resource. */
    public static LoadedGraph loadResource(String resource) {
        return load(GraphDefinitionParser.parseResource(resource));
    }

    private static PinRef resolve(ShaderGraph graph, Map<String, Integer> ids, String ref, String consumer) {
        if (ref == null)
            throw new IllegalArgumentException("Null input reference in node '" + consumer + "'");
        Integer id = ids.get(ref);
        if (id != null) {
            ShaderNode producer = graph.requireNode(id);
            if (producer.outputs().isEmpty())
                throw new IllegalArgumentException("Node '" + consumer + "' reads from " + producer
                        + ", which has no outputs");
            return new PinRef(id, producer.outputs().get(0).name());
        }
        int dot = ref.lastIndexOf('.');
        if (dot > 0) {
            id = ids.get(ref.substring(0, dot));
            if (id != null)
                return new PinRef(id, ref.substring(dot + 1));
        }
        throw new IllegalArgumentException("Node '" + consumer + "' references unknown node: " + ref);
    }

    private record PinRef(int nodeId, String pin) {
    }
}

package com.shading.sgc.util;

import com.shading.sgc.compile.CompiledShader;
import com.shading.sgc.model.InputPin;
import com.shading.sgc.model.Link;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a graph and the order a compile chose.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and logging. Allocates
 * strings freely; do not call it from an editor's per-frame path.
 */
public final class GraphExplain {
    private final ShaderGraph graph;

    public GraphExplain(ShaderGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps one node: kind, configuration and the binding of each input pin.
     */
    public String explainNode(int nodeId) {
        ShaderNode node = graph.requireNode(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node).append('\n')
                .append("  Kind: ").append(node.kind()).append(" (").append(node.kind().category()).append(")\n");
        for (Map.Entry<String, Object> e : node.properties().entrySet())
            sb.append("  ").append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
        for (InputPin pin : node.inputs()) {
            sb.append("  <- ").append(pin.name()).append(": ");
            graph.inboundLink(nodeId, pin.name()).ifPresentOrElse(
                    l -> sb.append(graph.requireNode(l.producerId())).append('.').append(l.producerPin()),
                    () -> sb.append("default ").append(pin.defaultValue().components()));
            sb.append('\n');
        }
        List<Link> out = graph.outboundLinks(nodeId);
        sb.append("  Consumers (").append(out.size()).append(")\n");
        return sb.toString();
    }

    /**
     * Dumps a compile's node order, one line per node with the consumers each
     * output feeds.
     */
    public String dumpOrder(CompiledShader shader) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Order (").append(shader.order().size()).append(" nodes, ")
                .append(shader.dialect()).append("):\n");
        List<Integer> order = shader.order();
        for (int i = 0; i < order.size(); i++) {
            ShaderNode node = graph.requireNode(order.get(i));
            sb.append("  [").append(i).append("] ").append(node);
            List<Link> out = graph.outboundLinks(node.id());
            if (!out.isEmpty()) {
                sb.append(" -> ");
                for (int j = 0; j < out.size(); j++) {
                    Link l = out.get(j);
                    sb.append(graph.requireNode(l.consumerId())).append('.').append(l.consumerPin());
                    if (j < out.size() - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        shader.diagnostics().forEach(d -> sb.append("  ! ").append(d).append('\n'));
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart of the whole graph, edges labelled with
     * their pin names.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("graph LR;\n");

        // 1. Declare nodes in id order
        for (ShaderNode node : graph.nodes()) {
            sb.append("  ").append(id(node.id())).append("[\"").append(node.kind().title());
            Object name = node.properties().get("name");
            if (name != null)
                sb.append(": ").append(name);
            sb.append("\"];\n");
        }

        // 2. Declare all edges afterwards
        for (Link l : graph.links()) {
            sb.append("  ").append(id(l.producerId())).append(" -- \"").append(l.producerPin()).append(" to ")
                    .append(l.consumerPin()).append("\" --> ").append(id(l.consumerId())).append(";\n");
        }
        return sb.toString();
    }

    private static String id(int nodeId) {
        return "n" + nodeId;
    }
}

package com.shading.sgc.model;

import com.shading.sgc.api.ValueKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The live shader graph edited by the host.
 *
 * Nodes live in an arena indexed by integer id. Links are plain id-based
 * records kept in a separate table keyed by the consuming input pin, which
 * gives the single-link-per-input invariant for free: connecting an input
 * that is already connected replaces its link.
 *
 * A graph holds at most one {@link NodeKind#OUTPUT} node (the sink). Removing
 * it is allowed; the compiler then emits its fallback color.
 *
 * Thread Safety:
 * Not thread-safe. The host owns the graph and must not edit it while a
 * compile is running; the compiler itself only reads it.
 */
public final class ShaderGraph {
    private static final Logger log = LogManager.getLogger(ShaderGraph.class);

    private final NodeRegistry registry;
    private final Map<Integer, ShaderNode> nodes = new LinkedHashMap<>();
    private final Map<InputKey, Link> links = new LinkedHashMap<>();

    private int nextId = 1;
    private Integer outputId;

    public ShaderGraph() {
        this(NodeRegistry.builtIns());
    }

    public ShaderGraph(NodeRegistry registry) {
        this.registry = registry;
    }

    /** Creates a graph containing only the output node. */
    public static ShaderGraph withOutput() {
        ShaderGraph g = new ShaderGraph();
        g.addNode(NodeKind.OUTPUT);
        return g;
    }

    /** Creates the editor's initial graph: a color constant wired to the output color. */
    public static ShaderGraph withDefaultSetup() {
        ShaderGraph g = new ShaderGraph();
        ShaderNode output = g.addNode(NodeKind.OUTPUT);
        ShaderNode color = g.addNode(NodeKind.COLOR);
        g.connect(color.id(), "RGB", output.id(), "Color");
        return g;
    }

    // ── Node edits ──────────────────────────────────────────────

    public ShaderNode addNode(NodeKind kind) {
        return addNode(kind, Map.of());
    }

    /**
     * Adds a node of the given kind and applies the given configuration.
     * Parameter nodes without a name get {@code param<id>}.
     *
     * @throws IllegalStateException    if a second output node is added.
     * @throws IllegalArgumentException if a property is unknown or invalid.
     */
    public ShaderNode addNode(NodeKind kind, Map<String, Object> properties) {
        if (kind == NodeKind.OUTPUT && outputId != null)
            throw new IllegalStateException("Graph already has an output node: " + outputId);

        ShaderNode node = new ShaderNode(nextId, registry.descriptor(kind));
        properties.forEach(node::setProperty);
        if (kind.isParameter()) {
            if (!node.properties().containsKey("name"))
                node.setProperty("name", "param" + node.id());
            if (!node.properties().containsKey("label"))
                node.setProperty("label", node.properties().get("name"));
        }

        nextId++;
        nodes.put(node.id(), node);
        if (kind == NodeKind.OUTPUT)
            outputId = node.id();
        return node;
    }

    /**
     * Updates one property of a node.
     *
     * @throws IllegalArgumentException if the node or property is unknown, or
     *                                  the value is invalid.
     */
    public void configure(int nodeId, String key, Object value) {
        requireNode(nodeId).setProperty(key, value);
    }

    /**
     * Removes a node and every link that touches it.
     *
     * @return false if no such node existed.
     */
    public boolean removeNode(int nodeId) {
        ShaderNode removed = nodes.remove(nodeId);
        if (removed == null)
            return false;
        int before = links.size();
        links.values().removeIf(l -> l.producerId() == nodeId || l.consumerId() == nodeId);
        if (outputId != null && outputId == nodeId)
            outputId = null;
        log.debug("Removed {} and {} link(s)", removed, before - links.size());
        return true;
    }

    // ── Link edits ──────────────────────────────────────────────

    /**
     * Connects an output pin to an input pin, replacing the input's previous
     * link if there was one.
     *
     * @return the link that was replaced, if any.
     * @throws IllegalArgumentException if a node or pin is unknown, or the input
     *                                  rejects the producer's kind.
     */
    public Optional<Link> connect(int producerId, String producerPin, int consumerId, String consumerPin) {
        ShaderNode producer = requireNode(producerId);
        ShaderNode consumer = requireNode(consumerId);
        OutputPin out = producer.output(producerPin);
        InputPin in = consumer.input(consumerPin);

        // A polymorphic producer has no kind until compile time; the compiler re-checks.
        if (!out.polymorphic()) {
            ValueKind producerKind = producer.nominalKind(producerPin);
            if (!in.filter().accepts(producerKind, in.kind()))
                throw new IllegalArgumentException("Cannot connect " + producerKind + " output " + producer + "."
                        + producerPin + " to " + in.kind() + " input " + consumer + "." + consumerPin);
        }

        Link link = new Link(producerId, producerPin, consumerId, consumerPin);
        return Optional.ofNullable(links.put(new InputKey(consumerId, consumerPin), link));
    }

    /**
     * Removes the link into the given input pin.
     *
     * @return the removed link, if any.
     */
    public Optional<Link> disconnect(int consumerId, String consumerPin) {
        return Optional.ofNullable(links.remove(new InputKey(consumerId, consumerPin)));
    }

    // ── Queries ─────────────────────────────────────────────────

    /**
     * @throws IllegalArgumentException if the node does not exist.
     */
    public ShaderNode requireNode(int nodeId) {
        ShaderNode node = nodes.get(nodeId);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return node;
    }

    public Optional<ShaderNode> node(int nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /** All nodes in id order. */
    public Collection<ShaderNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public Collection<Link> links() {
        return Collections.unmodifiableCollection(links.values());
    }

    /** The link feeding the given input pin, if connected. */
    public Optional<Link> inboundLink(int consumerId, String consumerPin) {
        return Optional.ofNullable(links.get(new InputKey(consumerId, consumerPin)));
    }

    /** Every link leaving the given node. */
    public List<Link> outboundLinks(int producerId) {
        List<Link> out = new ArrayList<>();
        for (Link l : links.values())
            if (l.producerId() == producerId)
                out.add(l);
        return out;
    }

    /** The sink, if the graph has one. */
    public Optional<ShaderNode> output() {
        return outputId == null ? Optional.empty() : node(outputId);
    }

    private record InputKey(int consumerId, String pin) {
    }
}

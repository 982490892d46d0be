package com.shading.sgc.model;

import com.shading.sgc.api.KindProbe;
import com.shading.sgc.api.ValueKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node in a shader graph.
 *
 * A node is identified by an integer id that is stable for its lifetime and
 * never reused by its graph. Its pins come from the {@link NodeDescriptor} of
 * its kind; its configuration is a property map that only the owning
 * {@link ShaderGraph} may change.
 */
public final class ShaderNode {
    private final int id;
    private final NodeDescriptor descriptor;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    ShaderNode(int id, NodeDescriptor descriptor) {
        this.id = id;
        this.descriptor = descriptor;
        this.properties.putAll(descriptor.propertyDefaults());
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return descriptor.kind();
    }

    public NodeDescriptor descriptor() {
        return descriptor;
    }

    public List<InputPin> inputs() {
        return descriptor.inputs();
    }

    public List<OutputPin> outputs() {
        return descriptor.outputs();
    }

    /** Read-only view of the node's configuration. */
    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    /**
     * @throws IllegalArgumentException if the node has no such input.
     */
    public InputPin input(String name) {
        return descriptor.input(name).orElseThrow(
                () -> new IllegalArgumentException("Node " + id + " (" + kind() + ") has no input '" + name + "'"));
    }

    /**
     * @throws IllegalArgumentException if the node has no such output.
     */
    public OutputPin output(String name) {
        return descriptor.output(name).orElseThrow(
                () -> new IllegalArgumentException("Node " + id + " (" + kind() + ") has no output '" + name + "'"));
    }

    /**
     * Kind of an output pin with every input left at its default.
     * Exact for all non-polymorphic pins.
     */
    public ValueKind nominalKind(String outputPin) {
        return output(outputPin).resolver().resolve(new KindProbe() {
            @Override
            public List<String> inputPins() {
                return descriptor.inputNames();
            }

            @Override
            public ValueKind inputKind(String inputPin) {
                return input(inputPin).kind();
            }

            @Override
            public Map<String, Object> properties() {
                return ShaderNode.this.properties();
            }
        });
    }

    void setProperty(String key, Object value) {
        PropertyType type = descriptor.propertyTypes().get(key);
        if (type == null)
            throw new IllegalArgumentException("Node " + id + " (" + kind() + ") has no property '" + key + "'");
        properties.put(key, type.normalize(key, value));
    }

    @Override
    public String toString() {
        return kind().title() + "#" + id;
    }
}

package com.shading.sgc.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static description of a node kind: its pins and configurable properties.
 *
 * @param kind             the described kind.
 * @param inputs           input pins in declaration order.
 * @param outputs          output pins in declaration order.
 * @param propertyTypes    configurable properties and their types.
 * @param propertyDefaults initial values of the properties.
 */
public record NodeDescriptor(NodeKind kind, List<InputPin> inputs, List<OutputPin> outputs,
        Map<String, PropertyType> propertyTypes, Map<String, Object> propertyDefaults) {

    public NodeDescriptor {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        propertyTypes = Map.copyOf(propertyTypes);
        propertyDefaults = Map.copyOf(propertyDefaults);
    }

    public Optional<InputPin> input(String name) {
        for (InputPin pin : inputs)
            if (pin.name().equals(name))
                return Optional.of(pin);
        return Optional.empty();
    }

    public Optional<OutputPin> output(String name) {
        for (OutputPin pin : outputs)
            if (pin.name().equals(name))
                return Optional.of(pin);
        return Optional.empty();
    }

    public List<String> inputNames() {
        return inputs.stream().map(InputPin::name).toList();
    }
}

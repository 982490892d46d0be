package com.shading.sgc.model;

import com.shading.sgc.api.ConnectionFilter;
import com.shading.sgc.api.Literal;
import com.shading.sgc.api.ValueKind;

/**
 * Declared input of a node kind.
 *
 * @param name         unique among the node's inputs.
 * @param kind         declared kind; also the kind of {@code defaultValue}.
 * @param defaultValue literal used while the pin is unconnected.
 * @param filter       which producer kinds the pin accepts.
 */
public record InputPin(String name, ValueKind kind, Literal defaultValue, ConnectionFilter filter) {

    public InputPin {
        if (defaultValue.kind() != kind)
            throw new IllegalArgumentException("Default of pin " + name + " is " + defaultValue.kind() + ", not " + kind);
    }

    static InputPin scalar(String name, double defaultValue) {
        return new InputPin(name, ValueKind.SCALAR, Literal.scalar(defaultValue), ConnectionFilter.SAME_KIND);
    }

    static InputPin anyKind(String name, double defaultValue) {
        return new InputPin(name, ValueKind.SCALAR, Literal.scalar(defaultValue), ConnectionFilter.ANY);
    }

    static InputPin vector3(String name, double x, double y, double z) {
        return new InputPin(name, ValueKind.VECTOR3, Literal.vector3(x, y, z), ConnectionFilter.SAME_KIND);
    }
}

package com.shading.sgc.api;

import java.util.Arrays;
import java.util.List;

/**
 * A constant value of a given kind, rendered by the target dialect.
 *
 * Used for input pin defaults and for the configured values of constant nodes.
 */
public record Literal(ValueKind kind, List<Double> components) {

    public Literal {
        components = List.copyOf(components);
        if (components.size() != kind.components())
            throw new IllegalArgumentException(
                    kind + " literal needs " + kind.components() + " components, got " + components.size());
    }

    public static Literal scalar(double value) {
        return new Literal(ValueKind.SCALAR, List.of(value));
    }

    public static Literal vector3(double x, double y, double z) {
        return new Literal(ValueKind.VECTOR3, List.of(x, y, z));
    }

    public static Literal of(List<Double> components) {
        return new Literal(ValueKind.ofComponents(components.size()), components);
    }

    /** All-zero literal of the given kind. */
    public static Literal zero(ValueKind kind) {
        Double[] zeros = new Double[kind.components()];
        Arrays.fill(zeros, 0.0);
        return new Literal(kind, List.of(zeros));
    }
}

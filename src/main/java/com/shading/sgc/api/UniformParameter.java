package com.shading.sgc.api;

import java.util.List;

/**
 * A user-exposed uniform, derived from a parameter node on every compile.
 *
 * @param name  identifier used in the generated source.
 * @param label display label for the host's UI.
 * @param kind  value kind of the uniform.
 * @param value current value, one entry per component.
 */
public record UniformParameter(String name, String label, ValueKind kind, List<Double> value) {

    public UniformParameter {
        value = List.copyOf(value);
    }
}

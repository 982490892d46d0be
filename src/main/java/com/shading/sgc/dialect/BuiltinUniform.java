package com.shading.sgc.dialect;

import com.shading.sgc.api.ValueKind;

import java.util.List;

/**
 * Uniforms every generated program declares, in declaration order.
 *
 * The default values are those the preview renderer binds; the runtime is
 * free to bind others.
 */
public enum BuiltinUniform {
    TIME("time", ValueKind.SCALAR, List.of(0.0)),
    LIGHT_POS("lightPos", ValueKind.VECTOR3, List.of(2.0, 2.0, 2.0)),
    VIEW_POS("viewPos", ValueKind.VECTOR3, List.of(0.0, 0.0, 3.0)),
    LIGHT_COLOR("lightColor", ValueKind.VECTOR3, List.of(1.0, 1.0, 1.0)),
    OBJECT_COLOR("objectColor", ValueKind.VECTOR3, List.of(0.3, 0.6, 0.9));

    private final String uniformName;
    private final ValueKind kind;
    private final List<Double> defaultValue;

    BuiltinUniform(String uniformName, ValueKind kind, List<Double> defaultValue) {
        this.uniformName = uniformName;
        this.kind = kind;
        this.defaultValue = defaultValue;
    }

    public String uniformName() {
        return uniformName;
    }

    public ValueKind kind() {
        return kind;
    }

    public List<Double> defaultValue() {
        return defaultValue;
    }

    public static boolean isBuiltin(String name) {
        for (BuiltinUniform u : values())
            if (u.uniformName.equals(name))
                return true;
        return false;
    }
}

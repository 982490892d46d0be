package com.shading.sgc.api;

/**
 * The value kind carried by a pin.
 *
 * The graph only deals in floating point values of one to four components.
 * Dialects map each kind to their own type name (e.g. vec3 vs float3).
 */
public enum ValueKind {
    SCALAR(1),
    VECTOR2(2),
    VECTOR3(3),
    VECTOR4(4);

    private final int components;

    ValueKind(int components) {
        this.components = components;
    }

    public int components() {
        return components;
    }

    /** Returns the kind with the larger component count. */
    public static ValueKind widest(ValueKind a, ValueKind b) {
        return a.components >= b.components ? a : b;
    }

    /**
     * Looks up the kind with the given component count.
     *
     * @throws IllegalArgumentException if the count is outside 1..4.
     */
    public static ValueKind ofComponents(int components) {
        for (ValueKind k : values()) {
            if (k.components == components)
                return k;
        }
        throw new IllegalArgumentException("No value kind with " + components + " components");
    }
}

package com.shading.sgc.model;

/**
 * The closed set of node variants a shader graph can contain.
 *
 * Pins and expression rules of each kind are declared in {@link NodeRegistry}.
 */
public enum NodeKind {
    // --- Inputs ---
    TIME(Category.INPUT, "Time"),
    POSITION(Category.INPUT, "Position"),
    NORMAL(Category.INPUT, "Normal"),
    FRESNEL(Category.INPUT, "Fresnel"),

    // --- Constants ---
    FLOAT(Category.CONSTANT, "Float"),
    COLOR(Category.CONSTANT, "Color"),

    // --- Math ---
    ADD(Category.MATH, "Add"),
    SUBTRACT(Category.MATH, "Subtract"),
    MULTIPLY(Category.MATH, "Multiply"),
    DIVIDE(Category.MATH, "Divide"),
    SIN(Category.MATH, "Sin"),
    COS(Category.MATH, "Cos"),
    ABS(Category.MATH, "Abs"),
    MIX(Category.MATH, "Mix"),
    CLAMP(Category.MATH, "Clamp"),

    // --- Vector ---
    MAKE_VEC3(Category.VECTOR, "Make Vec3"),
    SPLIT_VEC3(Category.VECTOR, "Split Vec3"),

    // --- Parameters ---
    SCALAR_PARAMETER(Category.PARAMETER, "Float Parameter"),
    VECTOR_PARAMETER(Category.PARAMETER, "Vector Parameter"),

    // --- Sink ---
    OUTPUT(Category.SINK, "Shader Output");

    public enum Category {
        INPUT, CONSTANT, MATH, VECTOR, PARAMETER, SINK
    }

    private final Category category;
    private final String title;

    NodeKind(Category category, String title) {
        this.category = category;
        this.title = title;
    }

    public Category category() {
        return category;
    }

    public String title() {
        return title;
    }

    public boolean isParameter() {
        return category == Category.PARAMETER;
    }

    public static NodeKind fromString(String text) {
        for (NodeKind k : NodeKind.values()) {
            if (k.name().equalsIgnoreCase(text)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown NodeKind: " + text);
    }
}

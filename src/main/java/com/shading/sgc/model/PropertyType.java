package com.shading.sgc.model;

import com.shading.sgc.dialect.BuiltinUniform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Value types of node properties, with the validation applied when the host
 * configures a node.
 *
 * {@link #normalize(String, Object)} converts loosely typed values (as they
 * arrive from JSON or a UI widget) into the canonical representation stored
 * on the node: Double, List&lt;Double&gt; or String.
 */
public enum PropertyType {
    NUMBER {
        @Override
        Object normalize(String key, Object value) {
            return finite(key, toDouble(key, value));
        }
    },
    COLOR {
        @Override
        Object normalize(String key, Object value) {
            List<Double> c = toDoubles(key, value);
            if (c.size() != 3)
                throw new IllegalArgumentException("Property '" + key + "' needs 3 components, got " + c.size());
            return c;
        }
    },
    VECTOR {
        @Override
        Object normalize(String key, Object value) {
            List<Double> c = toDoubles(key, value);
            if (c.size() < 2 || c.size() > 4)
                throw new IllegalArgumentException("Property '" + key + "' needs 2 to 4 components, got " + c.size());
            return c;
        }
    },
    IDENTIFIER {
        @Override
        Object normalize(String key, Object value) {
            String s = String.valueOf(value);
            if (!IDENTIFIER_PATTERN.matcher(s).matches())
                throw new IllegalArgumentException("Property '" + key + "' is not a valid identifier: " + s);
            if (isReserved(s))
                throw new IllegalArgumentException("Property '" + key + "' uses a reserved name: " + s);
            return s;
        }
    },
    TEXT {
        @Override
        Object normalize(String key, Object value) {
            return String.valueOf(value);
        }
    };

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TEMPORARY_PATTERN = Pattern.compile("tmp[0-9]+");

    // Names the generated source already declares, in either dialect.
    private static final Set<String> RESERVED = Set.of(
            "FragPos", "Normal", "FragColor", "finalColor", "finalAlpha",
            "main", "input", "PSInput", "PSMain", "PerFrame", "PerMaterial");

    // Keywords, type names and the built-in functions node expressions call.
    private static final Set<String> LANGUAGE_WORDS = Set.of(
            "float", "int", "uint", "bool", "void", "true", "false", "half", "double",
            "vec2", "vec3", "vec4", "float2", "float3", "float4", "mat3", "mat4", "float3x3", "float4x4",
            "uniform", "in", "out", "inout", "const", "return", "if", "else", "for", "while", "do",
            "break", "continue", "discard", "struct", "layout", "precision", "highp", "mediump", "lowp",
            "cbuffer", "register", "static", "sampler2D", "Texture2D", "SamplerState",
            "sin", "cos", "abs", "mix", "lerp", "clamp", "saturate", "normalize", "pow", "max", "min",
            "dot", "cross", "length", "floor", "fract", "frac", "sqrt", "step", "smoothstep");

    abstract Object normalize(String key, Object value);

    /** True if the name would clash with generated declarations or the target language. */
    public static boolean isReserved(String name) {
        return RESERVED.contains(name)
                || LANGUAGE_WORDS.contains(name)
                || BuiltinUniform.isBuiltin(name)
                || name.startsWith("gl_")
                || name.contains("__")
                || TEMPORARY_PATTERN.matcher(name).matches();
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number n)
            return n.doubleValue();
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not a number: " + value, e);
        }
    }

    private static double finite(String key, double v) {
        if (!Double.isFinite(v))
            throw new IllegalArgumentException("Property '" + key + "' must be finite: " + v);
        return v;
    }

    private static List<Double> toDoubles(String key, Object value) {
        List<Double> out = new ArrayList<>();
        if (value instanceof double[] arr) {
            for (double d : arr)
                out.add(finite(key, d));
        } else if (value instanceof List<?> list) {
            for (Object o : list)
                out.add(finite(key, toDouble(key, o)));
        } else {
            throw new IllegalArgumentException("Property '" + key + "' is not a list of numbers: " + value);
        }
        return List.copyOf(out);
    }
}

package com.shading.sgc.dialect;

import com.shading.sgc.api.Literal;
import com.shading.sgc.api.UniformParameter;
import com.shading.sgc.api.ValueKind;

import java.util.List;
import java.util.Locale;

/**
 * Target shading language of a compile.
 *
 * A dialect owns every piece of text that differs between backends: type
 * names, vector constructors, the interpolation function, and the fixed
 * boilerplate around the generated statements. Expression templates shared by
 * both dialects (arithmetic, swizzles, sin/cos/abs, clamp, pow, dot) are
 * written once in the node registry.
 */
public enum ShaderDialect {
    GLSL_330 {
        @Override
        public String typeName(ValueKind kind) {
            return switch (kind) {
                case SCALAR -> "float";
                case VECTOR2 -> "vec2";
                case VECTOR3 -> "vec3";
                case VECTOR4 -> "vec4";
            };
        }

        @Override
        public String interpolateFunction() {
            return "mix";
        }

        @Override
        public void appendPrologue(StringBuilder sb, List<UniformParameter> uniforms, String indent) {
            sb.append("#version 330 core\n");
            sb.append("out vec4 FragColor;\n\n");
            sb.append("in vec3 FragPos;\n");
            sb.append("in vec3 Normal;\n\n");
            for (BuiltinUniform u : BuiltinUniform.values())
                sb.append("uniform ").append(typeName(u.kind())).append(' ').append(u.uniformName()).append(";\n");
            for (UniformParameter p : uniforms)
                sb.append("uniform ").append(typeName(p.kind())).append(' ').append(p.name()).append(";\n");
            sb.append("\nvoid main()\n{\n");
        }

        @Override
        public List<String> finalization(String color, String alpha) {
            return List.of(
                    "vec3 finalColor = " + color + ";",
                    "float finalAlpha = " + alpha + ";",
                    "FragColor = vec4(finalColor, finalAlpha);");
        }

        @Override
        public String fallback() {
            return "FragColor = vec4(1.0, 0.0, 1.0, 1.0); // Error: No output node";
        }
    },

    HLSL_50 {
        @Override
        public String typeName(ValueKind kind) {
            return switch (kind) {
                case SCALAR -> "float";
                case VECTOR2 -> "float2";
                case VECTOR3 -> "float3";
                case VECTOR4 -> "float4";
            };
        }

        @Override
        public String interpolateFunction() {
            return "lerp";
        }

        @Override
        public void appendPrologue(StringBuilder sb, List<UniformParameter> uniforms, String indent) {
            sb.append("// Generated HLSL Shader\n");
            sb.append("// Shader Model 5.0\n\n");

            sb.append("cbuffer PerFrame : register(b0)\n{\n");
            for (BuiltinUniform u : BuiltinUniform.values())
                sb.append(indent).append(typeName(u.kind())).append(' ').append(u.uniformName()).append(";\n");
            sb.append("};\n\n");

            if (!uniforms.isEmpty()) {
                sb.append("cbuffer PerMaterial : register(b1)\n{\n");
                for (UniformParameter p : uniforms)
                    sb.append(indent).append(typeName(p.kind())).append(' ').append(p.name()).append(";\n");
                sb.append("};\n\n");
            }

            sb.append("struct PSInput\n{\n");
            sb.append(indent).append("float4 position : SV_POSITION;\n");
            sb.append(indent).append("float3 fragPos : TEXCOORD0;\n");
            sb.append(indent).append("float3 normal : NORMAL;\n");
            sb.append("};\n\n");

            sb.append("float4 PSMain(PSInput input) : SV_TARGET\n{\n");
            sb.append(indent).append("float3 FragPos = input.fragPos;\n");
            sb.append(indent).append("float3 Normal = input.normal;\n\n");
        }

        @Override
        public List<String> finalization(String color, String alpha) {
            return List.of(
                    "float3 finalColor = " + color + ";",
                    "float finalAlpha = " + alpha + ";",
                    "return float4(finalColor, finalAlpha);");
        }

        @Override
        public String fallback() {
            return "return float4(1.0, 0.0, 1.0, 1.0); // Error: No output node";
        }
    };

    public abstract String typeName(ValueKind kind);

    /** Name of the linear interpolation function. */
    public abstract String interpolateFunction();

    /**
     * Appends everything up to and including the opening brace of the entry
     * point: interpolated inputs, built-in uniforms, then user uniforms.
     */
    public abstract void appendPrologue(StringBuilder sb, List<UniformParameter> uniforms, String indent);

    /** Statements assigning the final color from the sink's resolved inputs. */
    public abstract List<String> finalization(String color, String alpha);

    /** The single statement emitted when the graph has no output node. */
    public abstract String fallback();

    public void appendEpilogue(StringBuilder sb) {
        sb.append("}\n");
    }

    public String declaration(ValueKind kind, String name, String expression) {
        return typeName(kind) + " " + name + " = " + expression + ";";
    }

    public String construct(ValueKind kind, String... components) {
        return typeName(kind) + "(" + String.join(", ", components) + ")";
    }

    public String literal(Literal literal, int precision) {
        List<Double> c = literal.components();
        if (literal.kind() == ValueKind.SCALAR)
            return formatNumber(c.get(0), precision);
        String[] parts = new String[c.size()];
        for (int i = 0; i < parts.length; i++)
            parts[i] = formatNumber(c.get(i), precision);
        return construct(literal.kind(), parts);
    }

    /** Fixed-point rendering; always contains a decimal point so the shader sees a float. */
    public static String formatNumber(double value, int precision) {
        return String.format(Locale.ROOT, "%." + Math.max(1, precision) + "f", value);
    }

    public static ShaderDialect fromString(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "glsl", "glsl_330" -> GLSL_330;
            case "hlsl", "hlsl_50" -> HLSL_50;
            default -> throw new IllegalArgumentException("Unknown dialect: " + text);
        };
    }
}

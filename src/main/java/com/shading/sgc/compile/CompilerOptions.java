package com.shading.sgc.compile;

import com.shading.sgc.dialect.ShaderDialect;
import com.shading.sgc.model.NodeProperties;

import java.util.Map;

/**
 * Settings of a {@link ShaderGraphCompiler}.
 *
 * @param dialect        target shading language.
 * @param floatPrecision decimals used when rendering literals.
 * @param indent         indentation of statements inside the entry point.
 */
public record CompilerOptions(ShaderDialect dialect, int floatPrecision, String indent) {

    public CompilerOptions {
        if (dialect == null)
            throw new IllegalArgumentException("dialect is required");
        if (floatPrecision < 1 || floatPrecision > 9)
            throw new IllegalArgumentException("floatPrecision must be within 1..9: " + floatPrecision);
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(ShaderDialect.GLSL_330, 3, "    ");
    }

    public CompilerOptions withDialect(ShaderDialect dialect) {
        return new CompilerOptions(dialect, floatPrecision, indent);
    }

    /**
     * Reads options from a loosely typed map (e.g. the {@code options} block of
     * a graph definition). Missing keys keep their defaults.
     * <p>
     * Keys: {@code dialect} ("glsl" / "hlsl"), {@code precision},
     * {@code indent} (number of spaces).
     */
    public static CompilerOptions fromProperties(Map<String, Object> props) {
        CompilerOptions d = defaults();
        if (props == null || props.isEmpty())
            return d;
        ShaderDialect dialect = props.containsKey("dialect")
                ? ShaderDialect.fromString(props.get("dialect").toString())
                : d.dialect();
        int precision = (int) NodeProperties.getDouble(props, "precision", d.floatPrecision());
        int indent = (int) NodeProperties.getDouble(props, "indent", d.indent().length());
        return new CompilerOptions(dialect, precision, " ".repeat(Math.max(0, indent)));
    }
}

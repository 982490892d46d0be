package com.shading.sgc.compile;

import com.shading.sgc.api.UniformParameter;
import com.shading.sgc.dialect.ShaderDialect;

import java.util.List;

/**
 * Stitches the final program text together: prologue with interpolated inputs
 * and uniforms, the indented body, then the epilogue.
 */
public final class ShaderAssembler {
    private ShaderAssembler() {
        // Utility class
    }

    public static String assemble(ShaderDialect dialect, String indent, List<UniformParameter> uniforms,
            List<String> body) {
        StringBuilder sb = new StringBuilder(512);
        dialect.appendPrologue(sb, uniforms, indent);
        for (String statement : body)
            sb.append(indent).append(statement).append('\n');
        dialect.appendEpilogue(sb);
        return sb.toString();
    }
}

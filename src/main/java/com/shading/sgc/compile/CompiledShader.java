package com.shading.sgc.compile;

import com.shading.sgc.api.Diagnostic;
import com.shading.sgc.api.UniformParameter;
import com.shading.sgc.dialect.ShaderDialect;

import java.util.List;

/**
 * Output of one compile.
 *
 * @param source      complete program text.
 * @param body        statements inside the entry point, unindented.
 * @param uniforms    user uniforms the host must bind.
 * @param diagnostics non-fatal findings, in the order they were raised.
 * @param order       sequenced node ids, sink last; empty without a sink.
 * @param dialect     dialect the source was written in.
 */
public record CompiledShader(String source, List<String> body, List<UniformParameter> uniforms,
        List<Diagnostic> diagnostics, List<Integer> order, ShaderDialect dialect) {

    public CompiledShader {
        body = List.copyOf(body);
        uniforms = List.copyOf(uniforms);
        diagnostics = List.copyOf(diagnostics);
        order = List.copyOf(order);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}

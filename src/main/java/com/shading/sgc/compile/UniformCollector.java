package com.shading.sgc.compile;

import com.shading.sgc.api.Diagnostic;
import com.shading.sgc.api.UniformParameter;
import com.shading.sgc.api.ValueKind;
import com.shading.sgc.model.NodeKind;
import com.shading.sgc.model.NodeProperties;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Derives the user uniforms from the parameter nodes of the whole graph.
 *
 * Unwired parameters are included: a parameter keeps its uniform slot while
 * it is temporarily disconnected from the sink.
 */
public final class UniformCollector {
    private UniformCollector() {
        // Utility class
    }

    /**
     * @param graph       the graph snapshot.
     * @param diagnostics receives a DUPLICATE_PARAMETER finding for each
     *                    repeated name; the first declaration wins.
     * @return uniforms in node id order.
     */
    public static List<UniformParameter> collect(ShaderGraph graph, Consumer<Diagnostic> diagnostics) {
        List<UniformParameter> uniforms = new ArrayList<>();
        Map<String, Integer> declaredBy = new HashMap<>();

        for (ShaderNode node : graph.nodes()) {
            if (!node.kind().isParameter())
                continue;
            UniformParameter uniform = toUniform(node);
            Integer first = declaredBy.putIfAbsent(uniform.name(), node.id());
            if (first != null) {
                diagnostics.accept(new Diagnostic(Diagnostic.Code.DUPLICATE_PARAMETER, node.id(), null,
                        "Uniform '" + uniform.name() + "' is already declared by node " + first));
                continue;
            }
            uniforms.add(uniform);
        }
        return uniforms;
    }

    static UniformParameter toUniform(ShaderNode node) {
        Map<String, Object> props = node.properties();
        String name = NodeProperties.getString(props, "name", "param" + node.id());
        String label = NodeProperties.getString(props, "label", name);
        if (node.kind() == NodeKind.SCALAR_PARAMETER)
            return new UniformParameter(name, label, ValueKind.SCALAR,
                    List.of(NodeProperties.getDouble(props, "value", 0.0)));
        List<Double> value = NodeProperties.getDoubles(props, "value", List.of(0.0, 0.0, 0.0));
        return new UniformParameter(name, label, ValueKind.ofComponents(value.size()), value);
    }
}

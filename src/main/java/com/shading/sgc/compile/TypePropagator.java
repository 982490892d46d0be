package com.shading.sgc.compile;

import com.shading.sgc.api.KindProbe;
import com.shading.sgc.api.ValueKind;
import com.shading.sgc.model.OutputPin;
import com.shading.sgc.model.ShaderNode;

import java.util.List;
import java.util.Map;

/**
 * Resolves the value kind of one output pin from the kinds bound to the node's
 * inputs.
 *
 * Resolution looks exactly one hop upstream: the bindings already carry the
 * producers' resolved kinds, and nodes are resolved in topological order, so
 * kinds propagate down a chain one node at a time.
 */
public final class TypePropagator {
    private TypePropagator() {
        // Utility class
    }

    /**
     * @param node     node being emitted.
     * @param pin      one of its output pins.
     * @param bindings resolved value of every input pin of the node.
     */
    public static ValueKind resolve(ShaderNode node, OutputPin pin, Map<String, ResolvedValue> bindings) {
        return pin.resolver().resolve(new KindProbe() {
            @Override
            public List<String> inputPins() {
                return node.descriptor().inputNames();
            }

            @Override
            public ValueKind inputKind(String inputPin) {
                ResolvedValue bound = bindings.get(inputPin);
                if (bound == null)
                    throw new IllegalArgumentException(node + " has no input '" + inputPin + "'");
                return bound.kind();
            }

            @Override
            public Map<String, Object> properties() {
                return node.properties();
            }
        });
    }
}

package com.shading.sgc.api;

/**
 * Resolves the value kind of one output pin.
 *
 * Almost every node kind declares a constant kind ({@link #fixed(ValueKind)}).
 * The polymorphic multiply derives its kind from its immediate producers
 * ({@link #WIDEST_INPUT}).
 */
@FunctionalInterface
public interface KindResolver {

    /**
     * Widest vector kind among the node's bound inputs, or SCALAR when every
     * input is scalar.
     */
    KindResolver WIDEST_INPUT = probe -> {
        ValueKind result = ValueKind.SCALAR;
        for (String pin : probe.inputPins())
            result = ValueKind.widest(result, probe.inputKind(pin));
        return result;
    };

    ValueKind resolve(KindProbe probe);

    static KindResolver fixed(ValueKind kind) {
        return probe -> kind;
    }
}

package com.shading.sgc.api;

/**
 * A non-fatal finding reported alongside the compiled source.
 *
 * Diagnostics never stop a compile: the affected value has already been
 * replaced by a fallback by the time the diagnostic is raised.
 *
 * @param code    category.
 * @param nodeId  node concerned, or -1 when not node specific.
 * @param pin     pin concerned, or null.
 * @param message human-readable description.
 */
public record Diagnostic(Code code, int nodeId, String pin, String message) {

    public enum Code {
        /** The graph has no output node; the fallback color was emitted. */
        MISSING_OUTPUT,
        /** A link closing a cycle was ignored; its consumer used the default. */
        CYCLE_BROKEN,
        /** A producer's resolved kind was rejected by the consuming input. */
        TYPE_MISMATCH,
        /** Two parameter nodes declare the same uniform name. */
        DUPLICATE_PARAMETER,
        /** An expression rule failed; a zero literal was emitted instead. */
        NODE_FAILED
    }

    public static Diagnostic of(Code code, String message) {
        return new Diagnostic(code, -1, null, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(code.name());
        if (nodeId >= 0)
            sb.append(" node=").append(nodeId);
        if (pin != null)
            sb.append(" pin=").append(pin);
        return sb.append(": ").append(message).toString();
    }
}

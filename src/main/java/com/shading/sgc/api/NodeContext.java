package com.shading.sgc.api;

import java.util.Map;

/**
 * Everything an {@link ExpressionRule} may read while rendering one output pin.
 *
 * Inputs are already resolved: either the expression registered for the
 * upstream producer (often a temporary name) or the pin's default literal.
 */
public interface NodeContext {

    /** Resolved expression bound to the named input pin. */
    String input(String inputPin);

    /** Node configuration (constant values, clamp range, parameter name...). */
    Map<String, Object> properties();

    /** Renders a literal in the target dialect. */
    String literal(Literal literal);

    /** Renders a vector constructor call, e.g. {@code vec3(x, y, z)}. */
    String construct(ValueKind kind, String... components);

    /** Renders the linear interpolation call ({@code mix} or {@code lerp}). */
    String interpolate(String a, String b, String t);
}

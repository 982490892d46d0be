package com.shading.sgc.compile;

import com.shading.sgc.api.ValueKind;

/**
 * What an output pin (or a bound input) stands for in the generated code: an
 * inline expression or a temporary's name, with its value kind.
 */
public record ResolvedValue(String expression, ValueKind kind) {
}

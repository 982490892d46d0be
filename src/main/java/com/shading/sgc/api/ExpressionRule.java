package com.shading.sgc.api;

/**
 * Fixed text template producing the expression of one output pin.
 *
 * Rules never evaluate anything: they only splice the resolved input
 * expressions into shader source.
 */
@FunctionalInterface
public interface ExpressionRule {

    String render(NodeContext ctx);
}

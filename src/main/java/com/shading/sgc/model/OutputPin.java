package com.shading.sgc.model;

import com.shading.sgc.api.ExpressionRule;
import com.shading.sgc.api.KindResolver;

/**
 * Declared output of a node kind.
 *
 * @param name        unique among the node's outputs.
 * @param resolver    value-kind resolver for this pin.
 * @param rule        expression template for this pin.
 * @param polymorphic true if the kind depends on what is connected upstream.
 */
public record OutputPin(String name, KindResolver resolver, ExpressionRule rule, boolean polymorphic) {
}

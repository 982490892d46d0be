package com.shading.sgc.api;

import java.util.List;
import java.util.Map;

/**
 * One-hop view of the kinds bound to a node's inputs.
 *
 * For a connected input this is the kind of the immediate upstream producer
 * as resolved so far; for an unconnected input it is the kind of the pin's
 * default literal. Nothing further upstream is visible.
 */
public interface KindProbe {

    /** Names of the node's input pins, in declaration order. */
    List<String> inputPins();

    /**
     * @param inputPin name of one of the node's input pins.
     * @return the kind bound to that input.
     * @throws IllegalArgumentException if the node has no such input.
     */
    ValueKind inputKind(String inputPin);

    /** Configuration of the node being resolved. */
    Map<String, Object> properties();
}

package com.shading.sgc.compile;

import com.shading.sgc.model.InputPin;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Counts, per node, how many sequenced input pins read one of its outputs.
 * The sink's inputs count; links dropped by cycle breaking do not.
 */
public final class FanOutCounter {
    private FanOutCounter() {
        // Utility class
    }

    public static Map<Integer, Integer> count(ShaderGraph graph, Sequence sequence) {
        Map<Integer, Integer> fanOut = new HashMap<>();
        for (int consumerId : sequence.order()) {
            ShaderNode consumer = graph.requireNode(consumerId);
            for (InputPin pin : consumer.inputs()) {
                graph.inboundLink(consumerId, pin.name())
                        .filter(link -> !sequence.isBroken(link))
                        .ifPresent(link -> fanOut.merge(link.producerId(), 1, Integer::sum));
            }
        }
        return fanOut;
    }

    /** Fan-out of a node, 0 when nothing reads it. */
    public static int of(Map<Integer, Integer> counts, int nodeId) {
        return counts.getOrDefault(nodeId, 0);
    }
}

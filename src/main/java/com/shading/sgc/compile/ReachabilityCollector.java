package com.shading.sgc.compile;

import com.shading.sgc.model.InputPin;
import com.shading.sgc.model.Link;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the nodes that can influence the sink.
 *
 * Walks input-pin links backwards from the sink, depth first, visiting each
 * node at most once. Anything not collected here is dead code and must never
 * reach the emitted source.
 */
public final class ReachabilityCollector {
    private ReachabilityCollector() {
        // Utility class
    }

    /**
     * @param graph  the graph snapshot.
     * @param sinkId id of the output node.
     * @return ids of the sink and every node it transitively depends on, in
     *         discovery order.
     */
    public static Set<Integer> collect(ShaderGraph graph, int sinkId) {
        Set<Integer> seen = new LinkedHashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(sinkId);

        while (!stack.isEmpty()) {
            int id = stack.pop();
            if (!seen.add(id))
                continue;
            ShaderNode node = graph.requireNode(id);
            // Push in reverse so the first input pin is explored first.
            for (int i = node.inputs().size() - 1; i >= 0; i--) {
                InputPin pin = node.inputs().get(i);
                Optional<Link> link = graph.inboundLink(id, pin.name());
                if (link.isPresent() && !seen.contains(link.get().producerId()))
                    stack.push(link.get().producerId());
            }
        }
        return seen;
    }
}

package com.shading.sgc.compile;

import com.shading.sgc.model.Link;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Orders the reachable nodes so that every producer precedes its consumers.
 *
 * Depth-first post-order starting at the sink, following input pins in
 * declaration order. The walk uses an explicit frame stack, so deep chains do
 * not hit the thread's stack limit.
 *
 * Cycles cannot be prevented at edit time, so they are broken here: a link
 * whose producer is still on the current path is a back edge. It is recorded
 * in {@link Sequence#brokenLinks()} and not followed; its consumer later falls
 * back to the pin's default.
 */
@Log4j2
public final class TopologicalSequencer {
    private TopologicalSequencer() {
        // Utility class
    }

    private enum Mark {
        ON_PATH, DONE
    }

    /**
     * @param graph     the graph snapshot.
     * @param reachable ids collected by {@link ReachabilityCollector}; links
     *                  leading elsewhere are ignored.
     * @param sinkId    id of the output node, which ends up last.
     */
    public static Sequence sequence(ShaderGraph graph, Set<Integer> reachable, int sinkId) {
        Map<Integer, Mark> marks = new HashMap<>();
        List<Integer> order = new ArrayList<>(reachable.size());
        Set<Link> broken = new LinkedHashSet<>();

        // Frame: {nodeId, index of the next input pin to explore}
        Deque<int[]> stack = new ArrayDeque<>();
        marks.put(sinkId, Mark.ON_PATH);
        stack.push(new int[] { sinkId, 0 });

        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            ShaderNode node = graph.requireNode(frame[0]);

            if (frame[1] == node.inputs().size()) {
                stack.pop();
                marks.put(frame[0], Mark.DONE);
                order.add(frame[0]);
                continue;
            }

            String pin = node.inputs().get(frame[1]++).name();
            Optional<Link> link = graph.inboundLink(frame[0], pin);
            if (link.isEmpty() || !reachable.contains(link.get().producerId()))
                continue;

            int producer = link.get().producerId();
            Mark mark = marks.get(producer);
            if (mark == null) {
                marks.put(producer, Mark.ON_PATH);
                stack.push(new int[] { producer, 0 });
            } else if (mark == Mark.ON_PATH) {
                broken.add(link.get());
                log.debug("Ignoring cyclic link {}", link.get());
            }
        }
        return new Sequence(order, broken);
    }
}

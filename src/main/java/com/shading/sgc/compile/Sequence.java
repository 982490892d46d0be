package com.shading.sgc.compile;

import com.shading.sgc.model.Link;

import java.util.List;
import java.util.Set;

/**
 * Result of topological sequencing.
 *
 * @param order       reachable node ids, every producer before its consumers;
 *                    the sink is last.
 * @param brokenLinks links that closed a cycle and were ignored.
 */
public record Sequence(List<Integer> order, Set<Link> brokenLinks) {

    public Sequence {
        order = List.copyOf(order);
        brokenLinks = Set.copyOf(brokenLinks);
    }

    public boolean isBroken(Link link) {
        return brokenLinks.contains(link);
    }
}

package com.shading.sgc.compile;

import com.shading.sgc.model.NodeKind;
import com.shading.sgc.model.ShaderGraph;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class ReachabilityCollectorTest {

    @Test
    public void testSinkAloneIsReachable() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        assertEquals(Set.of(out), ReachabilityCollector.collect(g, out));
    }

    @Test
    public void testUnconnectedNodesAreExcluded() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int time = g.addNode(NodeKind.TIME).id();
        int sin = g.addNode(NodeKind.SIN).id();
        int dead = g.addNode(NodeKind.COS).id();
        g.connect(time, "Time", sin, "X");
        g.connect(time, "Time", dead, "X");
        g.connect(sin, "Result", out, "Alpha");

        Set<Integer> reachable = ReachabilityCollector.collect(g, out);

        assertEquals(Set.of(out, sin, time), reachable);
        assertFalse(reachable.contains(dead));
    }

    @Test
    public void testDiscoveryOrderFollowsPinDeclaration() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int color = g.addNode(NodeKind.COLOR).id();
        int alpha = g.addNode(NodeKind.FLOAT).id();
        // Wire Alpha first; Color is still declared first
        g.connect(alpha, "Value", out, "Alpha");
        g.connect(color, "RGB", out, "Color");

        assertEquals(List.of(out, color, alpha), List.copyOf(ReachabilityCollector.collect(g, out)));
    }

    @Test
    public void testCycleTerminates() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int a = g.addNode(NodeKind.ADD).id();
        int b = g.addNode(NodeKind.ADD).id();
        g.connect(a, "Result", b, "A");
        g.connect(b, "Result", a, "A");
        g.connect(a, "Result", out, "Alpha");

        assertEquals(Set.of(out, a, b), ReachabilityCollector.collect(g, out));
    }
}

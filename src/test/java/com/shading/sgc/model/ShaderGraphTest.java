package com.shading.sgc.model;

import com.shading.sgc.api.ValueKind;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.*;

public class ShaderGraphTest {

    @Test
    public void testDefaultSetup() {
        ShaderGraph g = ShaderGraph.withDefaultSetup();
        assertEquals(2, g.nodeCount());
        assertEquals(1, g.links().size());

        ShaderNode output = g.output().orElseThrow();
        Link link = g.inboundLink(output.id(), "Color").orElseThrow();
        assertEquals(NodeKind.COLOR, g.requireNode(link.producerId()).kind());
        assertEquals("RGB", link.producerPin());
    }

    @Test(expected = IllegalStateException.class)
    public void testSecondOutputRejected() {
        ShaderGraph g = ShaderGraph.withOutput();
        g.addNode(NodeKind.OUTPUT);
    }

    @Test
    public void testIdsAreNeverReused() {
        ShaderGraph g = new ShaderGraph();
        int a = g.addNode(NodeKind.TIME).id();
        assertTrue(g.removeNode(a));
        int b = g.addNode(NodeKind.TIME).id();
        assertNotEquals(a, b);
        assertFalse(g.removeNode(a));
    }

    @Test
    public void testConnectReplacesExistingLink() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int first = g.addNode(NodeKind.TIME).id();
        int second = g.addNode(NodeKind.FLOAT).id();

        assertTrue(g.connect(first, "Time", out, "Alpha").isEmpty());
        Optional<Link> replaced = g.connect(second, "Value", out, "Alpha");

        assertTrue(replaced.isPresent());
        assertEquals(first, replaced.get().producerId());
        assertEquals(1, g.links().size());
        assertEquals(second, g.inboundLink(out, "Alpha").orElseThrow().producerId());
    }

    @Test
    public void testOutputPinFansOut() {
        ShaderGraph g = new ShaderGraph();
        int time = g.addNode(NodeKind.TIME).id();
        int sin = g.addNode(NodeKind.SIN).id();
        int cos = g.addNode(NodeKind.COS).id();
        g.connect(time, "Time", sin, "X");
        g.connect(time, "Time", cos, "X");
        assertEquals(2, g.outboundLinks(time).size());
    }

    @Test
    public void testRemoveNodeCascadesLinks() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int time = g.addNode(NodeKind.TIME).id();
        int sin = g.addNode(NodeKind.SIN).id();
        g.connect(time, "Time", sin, "X");
        g.connect(sin, "Result", out, "Alpha");

        assertTrue(g.removeNode(sin));

        assertTrue(g.links().isEmpty());
        assertTrue(g.inboundLink(out, "Alpha").isEmpty());
        assertTrue(g.outboundLinks(time).isEmpty());
    }

    @Test
    public void testRemoveOutputLeavesNoSink() {
        ShaderGraph g = ShaderGraph.withDefaultSetup();
        int out = g.output().orElseThrow().id();
        assertTrue(g.removeNode(out));
        assertTrue(g.output().isEmpty());
        assertTrue(g.links().isEmpty());
        // A new sink may be added afterwards
        g.addNode(NodeKind.OUTPUT);
        assertTrue(g.output().isPresent());
    }

    @Test
    public void testDisconnect() {
        ShaderGraph g = ShaderGraph.withDefaultSetup();
        int out = g.output().orElseThrow().id();
        assertTrue(g.disconnect(out, "Color").isPresent());
        assertTrue(g.disconnect(out, "Color").isEmpty());
        assertTrue(g.links().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConnectRejectsKindMismatch() {
        ShaderGraph g = new ShaderGraph();
        int pos = g.addNode(NodeKind.POSITION).id();
        int add = g.addNode(NodeKind.ADD).id();
        g.connect(pos, "XYZ", add, "A");
    }

    @Test
    public void testMultiplyAcceptsVectorsAndFeedsVectorInputs() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int pos = g.addNode(NodeKind.POSITION).id();
        int mul = g.addNode(NodeKind.MULTIPLY).id();
        g.connect(pos, "XYZ", mul, "A");
        g.connect(mul, "Result", out, "Color");
        assertEquals(2, g.links().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConnectUnknownPin() {
        ShaderGraph g = ShaderGraph.withOutput();
        int time = g.addNode(NodeKind.TIME).id();
        g.connect(time, "Seconds", g.output().orElseThrow().id(), "Alpha");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConnectUnknownNode() {
        ShaderGraph g = ShaderGraph.withOutput();
        g.connect(42, "Time", g.output().orElseThrow().id(), "Alpha");
    }

    @Test
    public void testParameterDefaults() {
        ShaderGraph g = new ShaderGraph();
        ShaderNode p = g.addNode(NodeKind.SCALAR_PARAMETER);
        assertEquals("param" + p.id(), p.properties().get("name"));
        assertEquals("param" + p.id(), p.properties().get("label"));
        assertEquals(0.0, (Double) p.properties().get("value"), 0.0);

        ShaderNode named = g.addNode(NodeKind.SCALAR_PARAMETER, Map.of("name", "gain"));
        assertEquals("gain", named.properties().get("label"));
    }

    @Test
    public void testReservedParameterNamesRejected() {
        ShaderGraph g = new ShaderGraph();
        int p = g.addNode(NodeKind.SCALAR_PARAMETER).id();
        for (String name : List.of("tmp0", "time", "FragColor", "gl_Position", "a__b", "2fast", "my name")) {
            try {
                g.configure(p, "name", name);
                fail("Expected rejection of " + name);
            } catch (IllegalArgumentException expected) {
                // ok
            }
        }
        g.configure(p, "name", "tmpValue");
        assertEquals("tmpValue", g.requireNode(p).properties().get("name"));
    }

    @Test
    public void testLanguageWordsRejectedAsParameterNames() {
        ShaderGraph g = new ShaderGraph();
        int p = g.addNode(NodeKind.VECTOR_PARAMETER).id();
        for (String name : List.of("float", "vec3", "float3", "uniform", "return", "sin", "mix", "lerp",
                "normalize", "cbuffer")) {
            try {
                g.configure(p, "name", name);
                fail("Expected rejection of " + name);
            } catch (IllegalArgumentException expected) {
                assertTrue(expected.getMessage().contains("reserved"));
            }
        }
        g.configure(p, "name", "vec3Tint");
        assertEquals("vec3Tint", g.requireNode(p).properties().get("name"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownPropertyRejected() {
        ShaderGraph g = new ShaderGraph();
        int add = g.addNode(NodeKind.ADD).id();
        g.configure(add, "value", 1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteNumberRejected() {
        ShaderGraph g = new ShaderGraph();
        int f = g.addNode(NodeKind.FLOAT).id();
        g.configure(f, "value", Double.NaN);
    }

    @Test
    public void testVectorParameterKindFollowsValue() {
        ShaderGraph g = new ShaderGraph();
        ShaderNode p = g.addNode(NodeKind.VECTOR_PARAMETER);
        assertEquals(ValueKind.VECTOR3, p.nominalKind("Value"));
        g.configure(p.id(), "value", List.of(1, 2));
        assertEquals(ValueKind.VECTOR2, p.nominalKind("Value"));
        assertEquals(List.of(1.0, 2.0), p.properties().get("value"));
        g.configure(p.id(), "value", new double[] { 1, 2, 3, 4 });
        assertEquals(ValueKind.VECTOR4, p.nominalKind("Value"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testColorNeedsThreeComponents() {
        ShaderGraph g = new ShaderGraph();
        g.addNode(NodeKind.COLOR, Map.of("color", List.of(1.0, 0.0)));
    }

    @Test
    public void testNodeKindFromString() {
        assertEquals(NodeKind.MAKE_VEC3, NodeKind.fromString("make_vec3"));
        assertEquals(NodeKind.OUTPUT, NodeKind.fromString("Output"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeKind() {
        NodeKind.fromString("TEXTURE");
    }
}

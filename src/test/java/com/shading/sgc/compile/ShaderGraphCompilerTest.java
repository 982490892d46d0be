package com.shading.sgc.compile;

import com.shading.sgc.api.CompilationListener;
import com.shading.sgc.api.Diagnostic;
import com.shading.sgc.api.ValueKind;
import com.shading.sgc.dialect.ShaderDialect;
import com.shading.sgc.model.NodeKind;
import com.shading.sgc.model.ShaderGraph;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ShaderGraphCompilerTest {

    private final ShaderGraphCompiler compiler = new ShaderGraphCompiler();

    private static int occurrences(String text, String token) {
        int count = 0;
        for (int i = text.indexOf(token); i >= 0; i = text.indexOf(token, i + token.length()))
            count++;
        return count;
    }

    /** Output.Alpha = sin(time) + 0.5 */
    private static ShaderGraph sineGraph() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int time = g.addNode(NodeKind.TIME).id();
        int sin = g.addNode(NodeKind.SIN).id();
        int add = g.addNode(NodeKind.ADD).id();
        int half = g.addNode(NodeKind.FLOAT, Map.of("value", 0.5)).id();
        g.connect(time, "Time", sin, "X");
        g.connect(sin, "Result", add, "A");
        g.connect(half, "Value", add, "B");
        g.connect(add, "Result", out, "Alpha");
        return g;
    }

    @Test
    public void testDependencyOrdering() {
        CompiledShader shader = compiler.compile(sineGraph());

        assertEquals(List.of(
                "float tmp0 = sin(time);",
                "float tmp1 = (tmp0 + 0.500);",
                "vec3 finalColor = vec3(1.000, 0.500, 0.200);",
                "float finalAlpha = tmp1;",
                "FragColor = vec4(finalColor, finalAlpha);"), shader.body());
        assertTrue(shader.diagnostics().isEmpty());
        assertEquals(ShaderDialect.GLSL_330, shader.dialect());
    }

    @Test
    public void testDeadCodeExcluded() {
        ShaderGraph g = sineGraph();
        int time = g.nodes().stream().filter(n -> n.kind() == NodeKind.TIME).findFirst().orElseThrow().id();
        int cos = g.addNode(NodeKind.COS).id();
        g.connect(time, "Time", cos, "X");
        g.addNode(NodeKind.POSITION);

        CompiledShader shader = compiler.compile(g);

        assertFalse(shader.source().contains("cos("));
        assertFalse(shader.order().contains(cos));
        // Unreachable consumers do not force a temporary on shared sources
        assertTrue(shader.body().contains("float tmp0 = sin(time);"));
        assertEquals(5, shader.body().size());
    }

    @Test
    public void testCompileIsIdempotent() {
        ShaderGraph g = sineGraph();
        CompiledShader first = compiler.compile(g);
        CompiledShader second = compiler.compile(g);
        CompiledShader other = new ShaderGraphCompiler().compile(g);

        assertEquals(first.source(), second.source());
        assertEquals(first.source(), other.source());
        assertEquals(first.order(), second.order());
        assertTrue(second.source().contains("tmp0"));
        assertFalse(second.source().contains("tmp2"));
    }

    @Test
    public void testCompileDoesNotModifyGraph() {
        ShaderGraph g = sineGraph();
        int nodes = g.nodeCount();
        int links = g.links().size();
        compiler.compile(g);
        assertEquals(nodes, g.nodeCount());
        assertEquals(links, g.links().size());
    }

    @Test
    public void testMissingSinkEmitsFallback() {
        ShaderGraph g = new ShaderGraph();
        g.addNode(NodeKind.FLOAT);
        g.addNode(NodeKind.TIME);

        CompiledShader shader = compiler.compile(g);

        assertEquals(List.of("FragColor = vec4(1.0, 0.0, 1.0, 1.0); // Error: No output node"), shader.body());
        assertTrue(shader.order().isEmpty());
        assertEquals(1, shader.diagnostics().size());
        assertEquals(Diagnostic.Code.MISSING_OUTPUT, shader.diagnostics().get(0).code());
        assertTrue(shader.source().endsWith("{\n    FragColor = vec4(1.0, 0.0, 1.0, 1.0); // Error: No output node\n}\n"));
    }

    @Test
    public void testRemovedSinkEmitsFallback() {
        ShaderGraph g = ShaderGraph.withDefaultSetup();
        g.removeNode(g.output().orElseThrow().id());

        CompiledShader shader = compiler.compile(g);

        assertEquals(1, shader.body().size());
        assertTrue(shader.body().get(0).startsWith("FragColor = vec4(1.0, 0.0, 1.0, 1.0);"));
    }

    @Test
    public void testCycleIsBrokenWithDefault() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int a = g.addNode(NodeKind.ADD).id();
        int b = g.addNode(NodeKind.ADD).id();
        g.connect(b, "Result", a, "A");
        g.connect(a, "Result", b, "A");
        g.connect(a, "Result", out, "Alpha");

        CompiledShader shader = compiler.compile(g);

        assertEquals(List.of(
                "float tmp0 = (0.000 + 0.000);",
                "float tmp1 = (tmp0 + 0.000);",
                "vec3 finalColor = vec3(1.000, 0.500, 0.200);",
                "float finalAlpha = tmp1;",
                "FragColor = vec4(finalColor, finalAlpha);"), shader.body());
        assertEquals(1, shader.diagnostics().size());
        Diagnostic d = shader.diagnostics().get(0);
        assertEquals(Diagnostic.Code.CYCLE_BROKEN, d.code());
        assertEquals(b, d.nodeId());
        assertEquals("A", d.pin());
    }

    @Test
    public void testPolymorphicWidening() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int pos = g.addNode(NodeKind.POSITION).id();
        int mul = g.addNode(NodeKind.MULTIPLY).id();
        g.connect(pos, "XYZ", mul, "A");
        g.connect(mul, "Result", out, "Color");

        CompiledShader shader = compiler.compile(g);

        assertEquals("vec3 tmp0 = (FragPos * 1.000);", shader.body().get(0));
        assertEquals("vec3 finalColor = tmp0;", shader.body().get(1));
        assertTrue(shader.diagnostics().isEmpty());
    }

    @Test
    public void testWideningPropagatesOneHopAtATime() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int normal = g.addNode(NodeKind.NORMAL).id();
        int time = g.addNode(NodeKind.TIME).id();
        int first = g.addNode(NodeKind.MULTIPLY).id();
        int second = g.addNode(NodeKind.MULTIPLY).id();
        g.connect(time, "Time", first, "A");
        g.connect(normal, "Normal", first, "B");
        g.connect(first, "Result", second, "A");
        g.connect(second, "Result", out, "Color");

        CompiledShader shader = compiler.compile(g);

        assertEquals("vec3 tmp0 = (time * normalize(Normal));", shader.body().get(0));
        assertEquals("vec3 tmp1 = (tmp0 * 1.000);", shader.body().get(1));
    }

    @Test
    public void testScalarIntoVectorInputFallsBackToDefault() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int mul = g.addNode(NodeKind.MULTIPLY).id();
        g.connect(mul, "Result", out, "Color");

        CompiledShader shader = compiler.compile(g);

        assertEquals("float tmp0 = (1.000 * 1.000);", shader.body().get(0));
        assertEquals("vec3 finalColor = vec3(1.000, 0.500, 0.200);", shader.body().get(1));
        assertEquals(1, shader.diagnostics().size());
        Diagnostic d = shader.diagnostics().get(0);
        assertEquals(Diagnostic.Code.TYPE_MISMATCH, d.code());
        assertEquals(out, d.nodeId());
        assertEquals("Color", d.pin());
    }

    @Test
    public void testFanOutMaterializesOnce() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int two = g.addNode(NodeKind.FLOAT, Map.of("value", 2.0)).id();
        int a = g.addNode(NodeKind.ADD).id();
        int b = g.addNode(NodeKind.ADD).id();
        int c = g.addNode(NodeKind.ADD).id();
        g.connect(two, "Value", a, "A");
        g.connect(two, "Value", b, "A");
        g.connect(two, "Value", c, "A");
        g.connect(a, "Result", b, "B");
        g.connect(b, "Result", c, "B");
        g.connect(c, "Result", out, "Alpha");

        CompiledShader shader = compiler.compile(g);

        assertEquals(List.of(
                "float tmp0 = 2.000;",
                "float tmp1 = (tmp0 + 0.000);",
                "float tmp2 = (tmp0 + tmp1);",
                "float tmp3 = (tmp0 + tmp2);"), shader.body().subList(0, 4));
        assertEquals(1, occurrences(shader.source(), "2.000"));
        assertEquals(4, occurrences(shader.source(), "tmp0"));
    }

    @Test
    public void testSingleUseConstantIsInlined() {
        CompiledShader shader = compiler.compile(ShaderGraph.withDefaultSetup());

        assertEquals(List.of(
                "vec3 finalColor = vec3(1.000, 0.500, 0.200);",
                "float finalAlpha = 1.000;",
                "FragColor = vec4(finalColor, finalAlpha);"), shader.body());
    }

    @Test
    public void testEveryOutputOfASplitGetsATemporary() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int pos = g.addNode(NodeKind.POSITION).id();
        int split = g.addNode(NodeKind.SPLIT_VEC3).id();
        g.connect(pos, "XYZ", split, "Vec3");
        g.connect(split, "Y", out, "Alpha");

        CompiledShader shader = compiler.compile(g);

        assertEquals(List.of(
                "float tmp0 = (FragPos).x;",
                "float tmp1 = (FragPos).y;",
                "float tmp2 = (FragPos).z;",
                "vec3 finalColor = vec3(1.000, 0.500, 0.200);",
                "float finalAlpha = tmp1;",
                "FragColor = vec4(finalColor, finalAlpha);"), shader.body());
    }

    @Test
    public void testUnwiredParametersAreStillDeclared() {
        ShaderGraph g = ShaderGraph.withDefaultSetup();
        g.addNode(NodeKind.SCALAR_PARAMETER, Map.of("name", "gain", "label", "Gain", "value", 0.75));
        g.addNode(NodeKind.VECTOR_PARAMETER, Map.of("name", "offset", "value", List.of(1.0, 2.0)));

        CompiledShader shader = compiler.compile(g);

        assertEquals(2, shader.uniforms().size());
        assertEquals("gain", shader.uniforms().get(0).name());
        assertEquals("Gain", shader.uniforms().get(0).label());
        assertEquals(List.of(0.75), shader.uniforms().get(0).value());
        assertEquals(ValueKind.VECTOR2, shader.uniforms().get(1).kind());
        assertTrue(shader.source().contains("uniform float gain;\nuniform vec2 offset;\n"));
    }

    @Test
    public void testParameterExpressionIsItsName() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int tint = g.addNode(NodeKind.VECTOR_PARAMETER, Map.of("name", "tint")).id();
        g.connect(tint, "Value", out, "Color");

        CompiledShader shader = compiler.compile(g);

        assertEquals("vec3 finalColor = tint;", shader.body().get(0));
    }

    @Test
    public void testMixUsesDialectInterpolation() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        int mix = g.addNode(NodeKind.MIX).id();
        int clamp = g.addNode(NodeKind.CLAMP, Map.of("min", 0.25, "max", 0.75)).id();
        g.connect(mix, "Result", clamp, "X");
        g.connect(clamp, "Result", out, "Alpha");

        CompiledShader glsl = compiler.compile(g);
        CompiledShader hlsl = new ShaderGraphCompiler(CompilerOptions.defaults().withDialect(ShaderDialect.HLSL_50))
                .compile(g);

        assertEquals("float tmp0 = mix(0.000, 1.000, 0.500);", glsl.body().get(0));
        assertEquals("float tmp1 = clamp(tmp0, 0.250, 0.750);", glsl.body().get(1));
        assertEquals("float tmp0 = lerp(0.000, 1.000, 0.500);", hlsl.body().get(0));
    }

    @Test
    public void testDuplicateParameterOfOtherKindEmitsZero() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        g.addNode(NodeKind.SCALAR_PARAMETER, Map.of("name", "tint"));
        int vector = g.addNode(NodeKind.VECTOR_PARAMETER, Map.of("name", "tint", "value", List.of(1, 0, 0))).id();
        g.connect(vector, "Value", out, "Color");

        CompiledShader shader = compiler.compile(g);

        assertEquals(1, occurrences(shader.source(), "uniform float tint;"));
        assertFalse(shader.source().contains("uniform vec3 tint;"));
        assertFalse(shader.source().contains("finalColor = tint;"));
        assertEquals("vec3 finalColor = vec3(0.000, 0.000, 0.000);", shader.body().get(0));
        assertEquals(2, shader.diagnostics().size());
        assertEquals(Diagnostic.Code.DUPLICATE_PARAMETER, shader.diagnostics().get(0).code());
        Diagnostic mismatch = shader.diagnostics().get(1);
        assertEquals(Diagnostic.Code.TYPE_MISMATCH, mismatch.code());
        assertEquals(vector, mismatch.nodeId());
        assertEquals("Value", mismatch.pin());
    }

    @Test
    public void testDuplicateParameterOfSameKindSharesUniform() {
        ShaderGraph g = ShaderGraph.withOutput();
        int out = g.output().orElseThrow().id();
        g.addNode(NodeKind.SCALAR_PARAMETER, Map.of("name", "gain", "value", 0.5));
        int second = g.addNode(NodeKind.SCALAR_PARAMETER, Map.of("name", "gain", "value", 0.9)).id();
        g.connect(second, "Value", out, "Alpha");

        CompiledShader shader = compiler.compile(g);

        assertEquals(1, occurrences(shader.source(), "uniform float gain;"));
        assertTrue(shader.body().contains("float finalAlpha = gain;"));
        assertEquals(1, shader.diagnostics().size());
        assertEquals(Diagnostic.Code.DUPLICATE_PARAMETER, shader.diagnostics().get(0).code());
    }

    @Test
    public void testFloatPrecisionOption() {
        CompiledShader shader = new ShaderGraphCompiler(new CompilerOptions(ShaderDialect.GLSL_330, 1, "\t"))
                .compile(sineGraph());

        assertEquals("float tmp1 = (tmp0 + 0.5);", shader.body().get(1));
        assertTrue(shader.source().contains("\n\tfloat tmp0 = sin(time);\n"));
    }

    @Test
    public void testListenersObserveCompile() {
        List<String> events = new ArrayList<>();
        compiler.addListener(new CompilationListener() {
            @Override
            public void onCompileStart(int nodeCount) {
                events.add("start " + nodeCount);
            }

            @Override
            public void onNodeEmitted(int nodeId, String kindName, int temporaries) {
                events.add(kindName + " " + temporaries);
            }

            @Override
            public void onDiagnostic(Diagnostic diagnostic) {
                events.add(diagnostic.code().name());
            }

            @Override
            public void onCompileEnd(int statementCount) {
                events.add("end " + statementCount);
            }
        });

        compiler.compile(sineGraph());
        compiler.compile(new ShaderGraph());

        assertEquals(List.of("start 5", "TIME 0", "SIN 1", "FLOAT 0", "ADD 1", "end 5",
                "start 0", "MISSING_OUTPUT", "end 1"), events);
    }

    @Test(expected = NullPointerException.class)
    public void testNullGraph() {
        compiler.compile(null);
    }
}

package com.shading.sgc.compile;

import com.shading.sgc.api.CompilationListener;
import com.shading.sgc.api.Diagnostic;
import com.shading.sgc.api.Literal;
import com.shading.sgc.api.NodeContext;
import com.shading.sgc.api.ValueKind;
import com.shading.sgc.dialect.ShaderDialect;
import com.shading.sgc.model.InputPin;
import com.shading.sgc.model.Link;
import com.shading.sgc.model.OutputPin;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a sequenced graph into temporary declarations.
 *
 * One instance serves a single compile: it owns the table of resolved pins and
 * the temporary counter, so names restart at {@code tmp0} every compile.
 *
 * Materialization rule: a node without inputs whose output is read at most
 * once is inlined at its use site. Every other output becomes a temporary.
 */
final class ExpressionEmitter {
    private static final Logger log = LogManager.getLogger(ExpressionEmitter.class);

    static final String TEMPORARY_PREFIX = "tmp";

    private final ShaderGraph graph;
    private final Sequence sequence;
    private final Map<Integer, Integer> fanOut;
    private final ShaderDialect dialect;
    private final int precision;
    private final Map<String, ValueKind> uniformKinds;
    private final Consumer<Diagnostic> diagnostics;
    private final CompilationListener listener;

    private final Map<PinRef, ResolvedValue> resolved = new HashMap<>();
    private final List<String> statements = new ArrayList<>();
    private int nextTemporary;

    ExpressionEmitter(ShaderGraph graph, Sequence sequence, Map<Integer, Integer> fanOut,
            Map<String, ValueKind> uniformKinds, CompilerOptions options, Consumer<Diagnostic> diagnostics,
            CompilationListener listener) {
        this.graph = graph;
        this.sequence = sequence;
        this.fanOut = fanOut;
        this.dialect = options.dialect();
        this.precision = options.floatPrecision();
        this.uniformKinds = uniformKinds;
        this.diagnostics = diagnostics;
        this.listener = listener;
    }

    /**
     * Emits every sequenced node except the sink.
     *
     * @return the declarations, in order.
     */
    List<String> emitAll(int sinkId) {
        for (int id : sequence.order()) {
            if (id != sinkId)
                emit(graph.requireNode(id));
        }
        return Collections.unmodifiableList(statements);
    }

    /**
     * Binds every input pin of a node to a resolved value: the upstream
     * producer's, or the pin default when unconnected, cut by cycle breaking or
     * rejected by the pin's filter.
     */
    Map<String, ResolvedValue> bindInputs(ShaderNode node) {
        Map<String, ResolvedValue> bindings = new LinkedHashMap<>();
        for (InputPin pin : node.inputs())
            bindings.put(pin.name(), bind(node, pin));
        return bindings;
    }

    private ResolvedValue bind(ShaderNode node, InputPin pin) {
        Optional<Link> link = graph.inboundLink(node.id(), pin.name());
        if (link.isPresent() && !sequence.isBroken(link.get())) {
            ResolvedValue upstream = resolved.get(new PinRef(link.get().producerId(), link.get().producerPin()));
            if (upstream != null) {
                if (pin.filter().accepts(upstream.kind(), pin.kind()))
                    return upstream;
                diagnostics.accept(new Diagnostic(Diagnostic.Code.TYPE_MISMATCH, node.id(), pin.name(),
                        upstream.kind() + " value from " + link.get() + " does not fit " + pin.kind()
                                + " input; using its default"));
            }
        }
        return new ResolvedValue(dialect.literal(pin.defaultValue(), precision), pin.kind());
    }

    private void emit(ShaderNode node) {
        Map<String, ResolvedValue> bindings = bindInputs(node);
        NodeContext ctx = new EmitContext(node, bindings);
        boolean inline = node.inputs().isEmpty() && FanOutCounter.of(fanOut, node.id()) <= 1;

        int temporaries = 0;
        for (OutputPin pin : node.outputs()) {
            ResolvedValue value = render(node, pin, bindings, ctx);
            if (!inline) {
                String name = TEMPORARY_PREFIX + nextTemporary++;
                statements.add(dialect.declaration(value.kind(), name, value.expression()));
                value = new ResolvedValue(name, value.kind());
                temporaries++;
            }
            resolved.put(new PinRef(node.id(), pin.name()), value);
        }
        listener.onNodeEmitted(node.id(), node.kind().name(), temporaries);
    }

    private ResolvedValue render(ShaderNode node, OutputPin pin, Map<String, ResolvedValue> bindings,
            NodeContext ctx) {
        ValueKind kind = ValueKind.SCALAR;
        try {
            kind = TypePropagator.resolve(node, pin, bindings);
            if (node.kind().isParameter() && !declaresAs(node, kind))
                return zero(node, pin, kind);
            return new ResolvedValue(pin.rule().render(ctx), kind);
        } catch (RuntimeException e) {
            log.warn("Expression rule of {}.{} failed", node, pin.name(), e);
            diagnostics.accept(new Diagnostic(Diagnostic.Code.NODE_FAILED, node.id(), pin.name(),
                    "Expression failed (" + e.getMessage() + "); emitting zero"));
            return new ResolvedValue(dialect.literal(Literal.zero(kind), precision), kind);
        }
    }

    /** False when the uniform under this parameter's name was declared with another kind. */
    private boolean declaresAs(ShaderNode node, ValueKind kind) {
        ValueKind declared = uniformKinds.get(UniformCollector.toUniform(node).name());
        return declared == null || declared == kind;
    }

    private ResolvedValue zero(ShaderNode node, OutputPin pin, ValueKind kind) {
        String name = UniformCollector.toUniform(node).name();
        diagnostics.accept(new Diagnostic(Diagnostic.Code.TYPE_MISMATCH, node.id(), pin.name(),
                "Uniform '" + name + "' is declared as " + uniformKinds.get(name) + ", not " + kind
                        + "; emitting zero"));
        return new ResolvedValue(dialect.literal(Literal.zero(kind), precision), kind);
    }

    private record PinRef(int nodeId, String pin) {
    }

    private final class EmitContext implements NodeContext {
        private final ShaderNode node;
        private final Map<String, ResolvedValue> bindings;

        EmitContext(ShaderNode node, Map<String, ResolvedValue> bindings) {
            this.node = node;
            this.bindings = bindings;
        }

        @Override
        public String input(String inputPin) {
            ResolvedValue bound = bindings.get(inputPin);
            if (bound == null)
                throw new IllegalArgumentException(node + " has no input '" + inputPin + "'");
            return bound.expression();
        }

        @Override
        public Map<String, Object> properties() {
            return node.properties();
        }

        @Override
        public String literal(Literal literal) {
            return dialect.literal(literal, precision);
        }

        @Override
        public String construct(ValueKind kind, String... components) {
            return dialect.construct(kind, components);
        }

        @Override
        public String interpolate(String a, String b, String t) {
            return dialect.interpolateFunction() + "(" + a + ", " + b + ", " + t + ")";
        }
    }
}

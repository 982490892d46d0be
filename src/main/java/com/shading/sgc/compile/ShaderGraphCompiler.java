package com.shading.sgc.compile;

import com.shading.sgc.api.CompilationListener;
import com.shading.sgc.api.Diagnostic;
import com.shading.sgc.api.UniformParameter;
import com.shading.sgc.api.ValueKind;
import com.shading.sgc.dialect.ShaderDialect;
import com.shading.sgc.model.Link;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.model.ShaderNode;
import com.shading.sgc.util.CompositeCompilationListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a {@link ShaderGraph} into fragment shader source.
 *
 * Pipeline:
 * <ol>
 * <li>{@link UniformCollector} declares every parameter node, wired or not.</li>
 * <li>{@link ReachabilityCollector} keeps what the sink depends on.</li>
 * <li>{@link TopologicalSequencer} orders it and breaks cycles.</li>
 * <li>{@link FanOutCounter} decides which outputs need a temporary.</li>
 * <li>{@link ExpressionEmitter} resolves kinds and expressions node by node.</li>
 * <li>{@link ShaderAssembler} wraps the statements in the dialect's boilerplate.</li>
 * </ol>
 *
 * A compile never fails on graph content: problems are returned as
 * {@link Diagnostic}s next to a program that still compiles downstream. The
 * graph is only read, and no state survives between calls, so compiling an
 * unchanged graph twice yields identical text.
 *
 * Thread Safety:
 * An instance may be shared, but listeners are invoked on the compiling thread
 * and registering one while a compile runs is not supported.
 */
public final class ShaderGraphCompiler {
    private static final Logger log = LogManager.getLogger(ShaderGraphCompiler.class);

    private final CompilerOptions options;
    private final CompositeCompilationListener listeners = new CompositeCompilationListener();

    public ShaderGraphCompiler() {
        this(CompilerOptions.defaults());
    }

    public ShaderGraphCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public CompilerOptions options() {
        return options;
    }

    /** Registers an observer; listeners are called in registration order. */
    public void addListener(CompilationListener listener) {
        listeners.addForComposite(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * @param graph the graph to compile; must not be mutated during the call.
     * @return the generated source with uniforms and diagnostics.
     */
    public CompiledShader compile(ShaderGraph graph) {
        Objects.requireNonNull(graph, "graph");
        ShaderDialect dialect = options.dialect();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Consumer<Diagnostic> report = d -> {
            diagnostics.add(d);
            listeners.onDiagnostic(d);
        };

        listeners.onCompileStart(graph.nodeCount());
        List<UniformParameter> uniforms = UniformCollector.collect(graph, report);

        List<String> body = new ArrayList<>();
        List<Integer> order = List.of();
        Optional<ShaderNode> sink = graph.output();
        if (sink.isEmpty()) {
            report.accept(Diagnostic.of(Diagnostic.Code.MISSING_OUTPUT, "Graph has no output node"));
            body.add(dialect.fallback());
        } else {
            int sinkId = sink.get().id();
            Set<Integer> reachable = ReachabilityCollector.collect(graph, sinkId);
            Sequence sequence = TopologicalSequencer.sequence(graph, reachable, sinkId);
            for (Link broken : sequence.brokenLinks())
                report.accept(new Diagnostic(Diagnostic.Code.CYCLE_BROKEN, broken.consumerId(), broken.consumerPin(),
                        "Link " + broken + " closes a cycle; the input uses its default"));

            Map<Integer, Integer> fanOut = FanOutCounter.count(graph, sequence);
            Map<String, ValueKind> uniformKinds = new HashMap<>();
            for (UniformParameter uniform : uniforms)
                uniformKinds.put(uniform.name(), uniform.kind());
            ExpressionEmitter emitter = new ExpressionEmitter(graph, sequence, fanOut, uniformKinds, options, report,
                    listeners);
            body.addAll(emitter.emitAll(sinkId));

            Map<String, ResolvedValue> finals = emitter.bindInputs(sink.get());
            body.addAll(dialect.finalization(finals.get("Color").expression(), finals.get("Alpha").expression()));
            order = sequence.order();
        }

        String source = ShaderAssembler.assemble(dialect, options.indent(), uniforms, body);
        listeners.onCompileEnd(body.size());
        log.debug("Compiled {} node(s) into {} statement(s), {} uniform(s), {} diagnostic(s) [{}]",
                order.size(), body.size(), uniforms.size(), diagnostics.size(), dialect);
        return new CompiledShader(source, body, uniforms, diagnostics, order, dialect);
    }
}

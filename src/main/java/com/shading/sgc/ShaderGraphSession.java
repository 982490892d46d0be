package com.shading.sgc;

import com.shading.sgc.api.CompilationListener;
import com.shading.sgc.compile.CompiledShader;
import com.shading.sgc.compile.CompilerOptions;
import com.shading.sgc.compile.ShaderGraphCompiler;
import com.shading.sgc.io.GraphDefinitionLoader;
import com.shading.sgc.io.GraphDefinitionParser;
import com.shading.sgc.io.LoadedGraph;
import com.shading.sgc.model.ShaderGraph;
import com.shading.sgc.util.EmissionProfileListener;
import com.shading.sgc.util.GraphExplain;
import com.shading.sgc.util.LoggingCompilationListener;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper pairing a live graph with a compiler.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading JSON graph definitions</li>
 * <li>Configuring the {@link ShaderGraphCompiler} from the definition's options</li>
 * <li>Recompiling on request and keeping the latest result for the host</li>
 * </ul>
 * The host edits {@link #graph()} directly and calls {@link #compile()} after
 * each edit; nothing here runs in the background.
 */
public class ShaderGraphSession {
    private static final Logger log = LogManager.getLogger(ShaderGraphSession.class);

    private final String name;
    private final ShaderGraph graph;
    private final ShaderGraphCompiler compiler;
    private final LoadedGraph loaded;
    private CompiledShader lastCompiled;

    /**
     * Starts a session on the editor's default graph (a color wired to the output).
     */
    public ShaderGraphSession(CompilerOptions options) {
        this("untitled", ShaderGraph.withDefaultSetup(), options, null);
    }

    /**
     * Creates a session from a JSON graph definition file.
     *
     * @throws UncheckedIOException if the file cannot be read.
     */
    public ShaderGraphSession(Path jsonPath) {
        this(readFile(jsonPath));
    }

    public ShaderGraphSession(LoadedGraph loaded) {
        this(loaded.name(), loaded.graph(), loaded.options(), loaded);
    }

    private ShaderGraphSession(String name, ShaderGraph graph, CompilerOptions options, LoadedGraph loaded) {
        this.name = name;
        this.graph = graph;
        this.loaded = loaded;
        this.compiler = new ShaderGraphCompiler(options);
        this.compiler.addListener(new LoggingCompilationListener());
    }

    /** Loads a session from a classpath resource. */
    public static ShaderGraphSession fromResource(String resource) {
        return new ShaderGraphSession(GraphDefinitionLoader.loadResource(resource));
    }

    private static LoadedGraph readFile(Path jsonPath) {
        try {
            return GraphDefinitionLoader.load(GraphDefinitionParser.parseFile(jsonPath));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph definition from " + jsonPath, e);
        }
    }

    public String name() {
        return name;
    }

    public ShaderGraph graph() {
        return graph;
    }

    /**
     * Id of a node by its definition name.
     *
     * @throws IllegalArgumentException if the session was not loaded from a
     *                                  definition or has no such node.
     */
    public int nodeId(String nodeName) {
        if (loaded == null)
            throw new IllegalArgumentException("Session '" + name + "' has no named nodes");
        return loaded.nodeId(nodeName);
    }

    /**
     * Registers a listener to monitor compiles. Adds to, rather than replaces,
     * the listeners already registered.
     */
    public void addListener(CompilationListener listener) {
        compiler.addListener(listener);
    }

    /** Enables per-kind emission statistics and returns the collecting listener. */
    public EmissionProfileListener enableProfiling() {
        EmissionProfileListener profile = new EmissionProfileListener();
        compiler.addListener(profile);
        return profile;
    }

    /** Compiles the current graph state and remembers the result. */
    public CompiledShader compile() {
        lastCompiled = compiler.compile(graph);
        return lastCompiled;
    }

    /** Result of the latest {@link #compile()}, or null before the first. */
    public CompiledShader lastCompiled() {
        return lastCompiled;
    }

    /** Writes a Mermaid diagram of the graph to the given file. */
    public void exportMermaid(Path target) throws IOException {
        Files.writeString(target, new GraphExplain(graph).toMermaid());
        log.info("Graph visualization saved to {}", target);
    }
}

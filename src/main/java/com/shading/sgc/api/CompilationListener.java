package com.shading.sgc.api;

/**
 * Observability interface for monitoring graph compilation.
 *
 * Implementations can be registered with the ShaderGraphCompiler to receive
 * callbacks during a compile pass. Typical uses are logging diagnostics for
 * the host, tracing which nodes produced temporaries, or counting statements.
 *
 * Callbacks run on the compiling thread and must not mutate the graph.
 */
public interface CompilationListener {

    /**
     * Called before a compile pass begins.
     *
     * @param nodeCount total number of nodes in the graph snapshot.
     */
    void onCompileStart(int nodeCount);

    /**
     * Called after a node's output pins have been resolved.
     *
     * @param nodeId      id of the node.
     * @param kindName    name of the node kind.
     * @param temporaries number of temporaries declared for the node (0 when
     *                    its expression was inlined).
     */
    void onNodeEmitted(int nodeId, String kindName, int temporaries);

    /**
     * Called for every non-fatal finding.
     */
    void onDiagnostic(Diagnostic diagnostic);

    /**
     * Called when the pass is complete.
     *
     * @param statementCount number of statements in the emitted body.
     */
    void onCompileEnd(int statementCount);
}

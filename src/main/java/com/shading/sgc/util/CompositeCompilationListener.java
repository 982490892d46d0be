package com.shading.sgc.util;

import com.shading.sgc.api.CompilationListener;
import com.shading.sgc.api.Diagnostic;

import java.util.Arrays;

/**
 * Fans every callback out to the registered {@link CompilationListener}s, in
 * registration order.
 */
public class CompositeCompilationListener implements CompilationListener {
    private CompilationListener[] listeners = new CompilationListener[0];

    public void addForComposite(CompilationListener listener) {
        CompilationListener[] old = listeners;
        CompilationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onCompileStart(int nodeCount) {
        for (CompilationListener l : listeners)
            l.onCompileStart(nodeCount);
    }

    @Override
    public void onNodeEmitted(int nodeId, String kindName, int temporaries) {
        for (CompilationListener l : listeners)
            l.onNodeEmitted(nodeId, kindName, temporaries);
    }

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {
        for (CompilationListener l : listeners)
            l.onDiagnostic(diagnostic);
    }

    @Override
    public void onCompileEnd(int statementCount) {
        for (CompilationListener l : listeners)
            l.onCompileEnd(statementCount);
    }
}

package com.shading.sgc.util;

import com.shading.sgc.api.CompilationListener;
import com.shading.sgc.api.Diagnostic;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes compile progress to the log: diagnostics at WARN, everything else at
 * DEBUG.
 */
public class LoggingCompilationListener implements CompilationListener {
    private static final Logger log = LogManager.getLogger(LoggingCompilationListener.class);

    private int compiles;

    @Override
    public void onCompileStart(int nodeCount) {
        compiles++;
        log.debug("Compile #{} started over {} node(s)", compiles, nodeCount);
    }

    @Override
    public void onNodeEmitted(int nodeId, String kindName, int temporaries) {
        if (log.isTraceEnabled())
            log.trace("Emitted {}#{} ({} temporaries)", kindName, nodeId, temporaries);
    }

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {
        log.warn("Compile #{}: {}", compiles, diagnostic);
    }

    @Override
    public void onCompileEnd(int statementCount) {
        log.debug("Compile #{} finished with {} statement(s)", compiles, statementCount);
    }

    public int compiles() {
        return compiles;
    }
}

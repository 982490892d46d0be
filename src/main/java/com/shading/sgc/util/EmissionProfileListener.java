package com.shading.sgc.util;

import com.shading.sgc.api.CompilationListener;
import com.shading.sgc.api.Diagnostic;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Aggregates, per node kind, how often it was emitted and how many temporaries it cost. */
public class EmissionProfileListener implements CompilationListener {

    public static class KindStats {
        public final String kind;
        public long emitted;
        public long inlined;
        public long temporaries;

        public KindStats(String kind) {
            this.kind = kind;
        }

        void update(int temps) {
            emitted++;
            if (temps == 0)
                inlined++;
            temporaries += temps;
        }
    }

    private final Map<String, KindStats> stats = new TreeMap<>();
    private long diagnostics;
    private long compiles;

    /** @return Read-only view of the stats, keyed by node kind name. */
    public Map<String, KindStats> getStats() {
        return Collections.unmodifiableMap(stats);
    }

    public long diagnostics() {
        return diagnostics;
    }

    public long compiles() {
        return compiles;
    }

    @Override
    public void onCompileStart(int nodeCount) {
        // No-op
    }

    @Override
    public void onNodeEmitted(int nodeId, String kindName, int temporaries) {
        stats.computeIfAbsent(kindName, KindStats::new).update(temporaries);
    }

    @Override
    public void onDiagnostic(Diagnostic diagnostic) {
        diagnostics++;
    }

    @Override
    public void onCompileEnd(int statementCount) {
        compiles++;
    }

    /** Resets all collected statistics. */
    public void reset() {
        stats.clear();
        diagnostics = 0;
        compiles = 0;
    }

    /** Formats the stats as a fixed-width table, one kind per row. */
    public String dump() {
        StringBuilder sb = new StringBuilder(256);
        sb.append(String.format("%-18s %8s %8s %8s%n", "Kind", "Emitted", "Inlined", "Temps"));
        for (KindStats s : stats.values())
            sb.append(String.format("%-18s %8d %8d %8d%n", s.kind, s.emitted, s.inlined, s.temporaries));
        return sb.toString();
    }
}

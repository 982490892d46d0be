package com.shading.sgc;

import com.shading.sgc.compile.CompiledShader;
import com.shading.sgc.dialect.ShaderDialect;
import com.shading.sgc.io.GraphDefinitionLoader;
import com.shading.sgc.io.LoadedGraph;
import com.shading.sgc.util.EmissionProfileListener;
import com.shading.sgc.util.GraphExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads the bundled pulse graph, compiles it for both dialects and logs the
 * result. Pass a resource name to compile another definition.
 */
public class ShaderGraphDemo {
    private static final Logger log = LogManager.getLogger(ShaderGraphDemo.class);

    public static void main(String[] args) {
        String resource = args.length > 0 ? args[0] : "graphs/pulse.json";
        log.info("Compiling {}", resource);

        LoadedGraph loaded = GraphDefinitionLoader.loadResource(resource);
        ShaderGraphSession session = new ShaderGraphSession(loaded);
        EmissionProfileListener profile = session.enableProfiling();

        CompiledShader glsl = session.compile();
        log.info("{} v{} ({}):\n{}", loaded.name(), loaded.version(), glsl.dialect(), glsl.source());
        log.info("\n{}", new GraphExplain(session.graph()).dumpOrder(glsl));

        ShaderGraphSession hlsl = new ShaderGraphSession(new LoadedGraph(loaded.name(), loaded.version(),
                loaded.graph(), loaded.nodeIds(), loaded.options().withDialect(ShaderDialect.HLSL_50)));
        log.info("HLSL_50:\n{}", hlsl.compile().source());

        glsl.uniforms().forEach(u -> log.info("uniform {} '{}' {} = {}", u.name(), u.label(), u.kind(), u.value()));
        log.info("Emission profile:\n{}", profile.dump());
    }
}

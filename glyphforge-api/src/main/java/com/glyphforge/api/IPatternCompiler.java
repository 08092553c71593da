package com.glyphforge.api;

import com.glyphforge.api.model.CompilationResult;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for compiling pattern DSL source into registered patterns.
 */
public interface IPatternCompiler {

    /**
     * Compiles one pattern source and registers the patterns it defines.
     *
     * @param source     DSL text
     * @param sourceName name used in logs and results
     * @return ids registered and warnings raised
     * @throws com.glyphforge.api.exceptions.ParseException if the source is malformed
     * @throws com.glyphforge.api.exceptions.RegistrationException on a duplicate pattern id
     * @throws com.glyphforge.api.exceptions.DslFatalException if evaluation aborts
     */
    CompilationResult compile(String source, String sourceName);

    /**
     * Compiles a pattern file.
     *
     * @throws IOException if the file cannot be read
     */
    CompilationResult compile(Path sourcePath) throws IOException;

    /**
     * Sets the tracer for observability.
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}

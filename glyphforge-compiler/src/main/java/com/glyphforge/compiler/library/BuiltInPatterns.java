package com.glyphforge.compiler.library;

import com.glyphforge.api.model.CompilationResult;
import com.glyphforge.compiler.PatternCompiler;
import com.glyphforge.compiler.registry.PatternRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * The pattern library shipped on the classpath: {@code checkbox}, {@code text_field} and
 * {@code button}.
 */
public final class BuiltInPatterns {

    public static final String RESOURCE = "/patterns/builtin.hunt";

    public static final List<String> IDS = List.of("checkbox", "text_field", "button");

    private BuiltInPatterns() {
    }

    public static String source() {
        try (InputStream in = BuiltInPatterns.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Compiles the library into {@code registry}.
     *
     * @throws com.glyphforge.api.exceptions.RegistrationException if any built-in id is
     *         already registered
     */
    public static CompilationResult registerInto(PatternRegistry registry) {
        return new PatternCompiler(registry).compile(source(), "builtin.hunt");
    }

    public static PatternRegistry newRegistry() {
        PatternRegistry registry = new PatternRegistry();
        registerInto(registry);
        return registry;
    }
}

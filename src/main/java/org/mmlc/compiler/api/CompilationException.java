package org.mmlc.compiler.api;

import org.mmlc.compiler.diagnostics.SemanticError;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal stage types of the compiler. The
 * diagnostics it carries are already sorted by source span.
 */
public class CompilationException extends Exception {

    private final List<SemanticError> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of());
    }

    /**
     * Constructs a new compilation exception with the specified detail message and diagnostics.
     * @param message The detail message, usually the rendered diagnostic summary.
     * @param diagnostics The sorted diagnostics that caused the failure.
     */
    public CompilationException(String message, List<SemanticError> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused this failure, in source order.
     */
    public List<SemanticError> getDiagnostics() {
        return diagnostics;
    }
}

package org.mmlc.compiler.api;

import org.mmlc.compiler.diagnostics.SemanticError;

import java.util.List;

/**
 * Result of compiling one of several modules: either the compiled module or the
 * diagnostics that prevented it.
 *
 * @param moduleName  The name of the module.
 * @param compiled    The result, or {@code null} on failure.
 * @param diagnostics The sorted diagnostics, empty on success.
 */
public record ModuleOutcome(String moduleName, CompiledModule compiled, List<SemanticError> diagnostics) {

    public ModuleOutcome {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if the module compiled without diagnostics.
     */
    public boolean isSuccess() {
        return compiled != null;
    }
}

package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.ResolvedTarget;

/**
 * Represents a declared name in the symbol table.
 *
 * @param name  The declared name.
 * @param kind  The kind of declaration.
 * @param span  The span of the declaration.
 * @param arity The parameter count of functions, {@code 0} otherwise.
 */
public record Symbol(String name, ResolvedTarget.Kind kind, SourceSpan span, int arity) {

    /**
     * @return The target a reference to this symbol is bound to.
     */
    public ResolvedTarget toTarget() {
        return new ResolvedTarget(kind, name, span, arity);
    }
}

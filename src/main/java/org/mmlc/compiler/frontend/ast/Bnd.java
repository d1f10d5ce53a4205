package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

/**
 * A top-level value binding, {@code let name = value;}.
 *
 * @param span    The span of the declaration.
 * @param name    The bound name.
 * @param value   The bound expression.
 * @param typeAsc The declared type, or {@code null}.
 */
public record Bnd(SourceSpan span, String name, Expr value, TypeSpec typeAsc) implements Decl {

    /**
     * @param newValue The replacement value.
     * @return A copy with the given value.
     */
    public Bnd withValue(Expr newValue) {
        return new Bnd(span, name, newValue, typeAsc);
    }
}

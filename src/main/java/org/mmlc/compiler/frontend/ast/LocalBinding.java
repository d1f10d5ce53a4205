package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

/**
 * A {@code let} inside a {@link Block}.
 *
 * @param span     The span of the whole binding.
 * @param name     The bound name.
 * @param value    The bound value.
 * @param typeAsc  The declared type, or {@code null}.
 */
public record LocalBinding(SourceSpan span, String name, Term value, TypeSpec typeAsc) {

    /**
     * @param newValue The replacement value.
     * @return A copy with the given value.
     */
    public LocalBinding withValue(Term newValue) {
        return new LocalBinding(span, name, newValue, typeAsc);
    }
}

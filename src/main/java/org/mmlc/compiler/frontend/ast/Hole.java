package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * The explicit "not implemented" marker {@code ???}. It has whatever type its context
 * expects.
 *
 * @param span     The span.
 * @param typeSpec The computed type, or {@code null}.
 */
public record Hole(SourceSpan span, TypeSpec typeSpec) implements Term {

    @Override
    public List<Term> children() {
        return List.of();
    }

    @Override
    public Term withChildren(List<Term> children) {
        return this;
    }

    @Override
    public Hole withSpan(SourceSpan newSpan) {
        return new Hole(newSpan, typeSpec);
    }

    @Override
    public Hole withType(TypeSpec type) {
        return new Hole(span, type);
    }
}

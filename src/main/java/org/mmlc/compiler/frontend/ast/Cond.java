package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * A conditional expression.
 *
 * @param span     The span.
 * @param cond     The condition, must be {@code Bool}.
 * @param ifTrue   The value when the condition holds.
 * @param ifFalse  The value otherwise.
 * @param typeSpec The computed type, or {@code null}.
 */
public record Cond(SourceSpan span, Term cond, Term ifTrue, Term ifFalse, TypeSpec typeSpec) implements Term {

    @Override
    public List<Term> children() {
        return List.of(cond, ifTrue, ifFalse);
    }

    @Override
    public Cond withChildren(List<Term> children) {
        return new Cond(span, children.get(0), children.get(1), children.get(2), typeSpec);
    }

    @Override
    public Cond withSpan(SourceSpan newSpan) {
        return new Cond(newSpan, cond, ifTrue, ifFalse, typeSpec);
    }

    @Override
    public Cond withType(TypeSpec type) {
        return new Cond(span, cond, ifTrue, ifFalse, type);
    }
}

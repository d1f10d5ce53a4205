package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * An ordered sequence of terms. As produced by the parser the sequence is flat and mixes
 * operands with bare operator references; after rewriting it holds a single nested term
 * (or several if rewriting reported an error).
 *
 * @param span     The span of the whole expression.
 * @param terms    The terms.
 * @param typeSpec The computed type, or {@code null}.
 */
public record Expr(SourceSpan span, List<Term> terms, TypeSpec typeSpec) implements Term {

    public Expr {
        terms = List.copyOf(terms);
    }

    /**
     * Creates an untyped expression.
     * @param span The span.
     * @param terms The terms.
     */
    public Expr(SourceSpan span, List<Term> terms) {
        this(span, terms, null);
    }

    /**
     * Wraps a single term, reusing it unchanged if it already is an expression.
     * @param term The term.
     * @return An expression containing the term.
     */
    public static Expr of(Term term) {
        if (term instanceof Expr expr) {
            return expr;
        }
        return new Expr(term.span(), List.of(term), term.typeSpec());
    }

    @Override
    public List<Term> children() {
        return terms;
    }

    @Override
    public Expr withChildren(List<Term> children) {
        return new Expr(span, children, typeSpec);
    }

    @Override
    public Expr withSpan(SourceSpan newSpan) {
        return new Expr(newSpan, terms, typeSpec);
    }

    @Override
    public Expr withType(TypeSpec type) {
        return new Expr(span, terms, type);
    }
}

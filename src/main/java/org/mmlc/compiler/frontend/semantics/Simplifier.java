package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.TreeWalker;
import org.mmlc.compiler.frontend.ast.Expr;
import org.mmlc.compiler.frontend.ast.Term;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * Removes expression wrappers that hold a single term. The inner term takes over a span
 * covering the wrapper and keeps its type and reference. Member bodies stay expressions.
 */
public final class Simplifier implements ISemanticPhase {

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        return state.withModule(TreeWalker.mapBodies(state.module(), Simplifier::simplifyBody));
    }

    /**
     * @param body A member body.
     * @return The simplified body, still an expression.
     */
    static Expr simplifyBody(Expr body) {
        Term simplified = TreeWalker.transform(body, Simplifier::unwrap);
        if (simplified instanceof Expr expr) {
            return expr;
        }
        return new Expr(SourceSpan.covering(body.span(), simplified.span()), List.of(simplified), simplified.typeSpec());
    }

    private static Term unwrap(Term term) {
        if (!(term instanceof Expr expr) || expr.terms().size() != 1) {
            return term;
        }
        Term inner = expr.terms().get(0);
        TypeSpec type = inner.typeSpec() != null ? inner.typeSpec() : expr.typeSpec();
        Term respanned = inner.withSpan(SourceSpan.covering(expr.span(), inner.span()));
        return type == null ? respanned : respanned.withType(type);
    }
}

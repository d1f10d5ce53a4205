package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * An anonymous, local function.
 *
 * @param span     The span.
 * @param params   The parameters.
 * @param body     The body.
 * @param typeSpec The computed function type, or {@code null}.
 */
public record Lambda(SourceSpan span, List<FnParam> params, Term body, TypeSpec typeSpec) implements Term {

    public Lambda {
        params = List.copyOf(params);
    }

    @Override
    public List<Term> children() {
        return List.of(body);
    }

    @Override
    public Lambda withChildren(List<Term> children) {
        return new Lambda(span, params, children.get(0), typeSpec);
    }

    @Override
    public Lambda withSpan(SourceSpan newSpan) {
        return new Lambda(newSpan, params, body, typeSpec);
    }

    @Override
    public Lambda withType(TypeSpec type) {
        return new Lambda(span, params, body, type);
    }
}

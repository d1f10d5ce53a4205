package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * A top-level function, {@code fn name(params): returnType = body;}.
 *
 * @param span       The span of the declaration.
 * @param name       The function name.
 * @param params     The parameters in order.
 * @param body       The body.
 * @param returnType The declared return type, or {@code null}.
 */
public record FnDef(SourceSpan span, String name, List<FnParam> params, Expr body, TypeSpec returnType)
        implements Decl {

    public FnDef {
        params = List.copyOf(params);
    }

    /**
     * @param newBody The replacement body.
     * @return A copy with the given body.
     */
    public FnDef withBody(Expr newBody) {
        return new FnDef(span, name, params, newBody, returnType);
    }
}

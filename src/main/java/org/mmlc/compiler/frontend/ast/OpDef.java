package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * A user or protocol declared operator, {@code op name(params) precedence assoc = body;}.
 * One parameter declares a prefix operator, two a binary one.
 *
 * @param span          The span of the declaration.
 * @param name          The operator symbol or word.
 * @param params        The parameters.
 * @param precedence    Binding strength, higher binds tighter.
 * @param associativity Grouping for equal precedence.
 * @param body          The implementation.
 * @param returnType    The declared return type, or {@code null}.
 */
public record OpDef(SourceSpan span, String name, List<FnParam> params, int precedence,
                    Associativity associativity, Expr body, TypeSpec returnType) implements Decl {

    public OpDef {
        params = List.copyOf(params);
    }

    /**
     * @return The number of operands.
     */
    public int arity() {
        return params.size();
    }

    /**
     * @param newBody The replacement body.
     * @return A copy with the given body.
     */
    public OpDef withBody(Expr newBody) {
        return new OpDef(span, name, params, precedence, associativity, newBody, returnType);
    }
}

package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

/**
 * An entry of the operator table.
 *
 * @param name          The operator symbol or word.
 * @param precedence    Binding strength, higher binds tighter.
 * @param associativity Grouping for equal precedence.
 * @param arity         {@code 1} for prefix operators, {@code 2} for binary operators.
 * @param signature     The operator's function type.
 * @param origin        Where the operator comes from.
 * @param span          The declaration span, {@link SourceSpan#SYNTHETIC} for built-ins.
 */
public record OperatorDef(String name, int precedence, Associativity associativity, int arity,
                          TypeSpec signature, Origin origin, SourceSpan span) {

    /**
     * Where an operator was defined.
     */
    public enum Origin {
        BUILTIN,
        DECLARED
    }

    /**
     * @param other Another definition of the same name and arity.
     * @return {@code true} if both group identically.
     */
    public boolean sameFixity(OperatorDef other) {
        return precedence == other.precedence && associativity == other.associativity;
    }

    /**
     * @return The fixity as written in diagnostics, e.g. {@code 60 left}.
     */
    public String fixity() {
        return precedence + " " + associativity.name().toLowerCase();
    }
}

package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;

/**
 * The declaration a {@link Ref} is bound to.
 *
 * @param kind     What kind of declaration was found.
 * @param name     The declared name.
 * @param declSpan The span of the declaration, unique per declaration.
 * @param arity    Parameter count for functions and operators; {@code 0} for plain values.
 *                 Operator references start out with {@link #UNSPECIALIZED_ARITY} until the
 *                 expression rewriter decides between the prefix and the binary variant.
 */
public record ResolvedTarget(Kind kind, String name, SourceSpan declSpan, int arity) {

    /** Arity of an operator reference whose fixity has not been chosen yet. */
    public static final int UNSPECIALIZED_ARITY = -1;

    /**
     * Kinds of declarations a name can resolve to.
     */
    public enum Kind {
        /** A top-level value binding. */
        BINDING,
        /** A top-level function. */
        FUNCTION,
        /** A function, operator or lambda parameter. */
        PARAMETER,
        /** A block-local let binding. */
        LOCAL,
        /** A built-in or declared operator. */
        OPERATOR
    }

    /**
     * @return A copy bound to the given operator arity.
     * @param newArity The chosen arity.
     */
    public ResolvedTarget withArity(int newArity) {
        return new ResolvedTarget(kind, name, declSpan, newArity);
    }
}

package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * A node inside an expression. Terms are immutable; every pipeline stage replaces the
 * terms it changes wholesale.
 * <p>
 * {@link #children()} and {@link #withChildren(List)} expose the direct sub-terms in a
 * fixed order so generic traversals (see {@code TreeWalker}) can rebuild any node.
 */
public sealed interface Term permits Ref, Literal, Expr, App, Cond, Hole, Lambda, Block {

    /**
     * @return The source range this term was produced from.
     */
    SourceSpan span();

    /**
     * @return The computed type, or {@code null} before type resolution.
     */
    TypeSpec typeSpec();

    /**
     * @return The direct sub-terms, in evaluation order.
     */
    List<Term> children();

    /**
     * Creates a copy of this term with its direct sub-terms replaced.
     * @param children The new sub-terms, same count and order as {@link #children()}.
     * @return The reconstructed term.
     */
    Term withChildren(List<Term> children);

    /**
     * @param span The new span.
     * @return A copy with the given span.
     */
    Term withSpan(SourceSpan span);

    /**
     * @param type The computed type.
     * @return A copy with the given type.
     */
    Term withType(TypeSpec type);
}

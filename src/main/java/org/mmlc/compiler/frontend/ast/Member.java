package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;

/**
 * A top-level entry of a {@link Module}.
 */
public sealed interface Member permits Decl, Comment, MemberError {

    /**
     * @return The source range of the member.
     */
    SourceSpan span();
}

package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;

/**
 * A documentation or line comment kept as a member.
 *
 * @param span The span.
 * @param text The comment text.
 */
public record Comment(SourceSpan span, String text) implements Member {}

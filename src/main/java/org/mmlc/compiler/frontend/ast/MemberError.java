package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;

/**
 * Placeholder for a member that could not be parsed or pre-validated. The failure is
 * deferred to the member-error gate at the end of semantic analysis.
 *
 * @param span             The span of the broken member.
 * @param message          What went wrong.
 * @param failedSourceText The offending source text, or {@code null} if unavailable.
 */
public record MemberError(SourceSpan span, String message, String failedSourceText) implements Member {}

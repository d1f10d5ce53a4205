package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

/**
 * A function, operator or lambda parameter.
 *
 * @param span    The span.
 * @param name    The parameter name.
 * @param typeAsc The declared type, or {@code null}.
 */
public record FnParam(SourceSpan span, String name, TypeSpec typeAsc) {}

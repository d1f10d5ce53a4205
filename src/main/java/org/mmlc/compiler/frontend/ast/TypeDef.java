package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

/**
 * A named type. A {@link TypeSpec.NativeStruct} definition declares an aggregate whose
 * layout the backend needs for call lowering.
 *
 * @param span       The span.
 * @param name       The type name.
 * @param definition The definition.
 */
public record TypeDef(SourceSpan span, String name, TypeSpec definition) implements Decl {}

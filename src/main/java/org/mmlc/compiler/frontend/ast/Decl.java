package org.mmlc.compiler.frontend.ast;

/**
 * A named top-level declaration.
 */
public sealed interface Decl extends Member permits FnDef, Bnd, OpDef, TypeDef {

    /**
     * @return The declared name.
     */
    String name();
}

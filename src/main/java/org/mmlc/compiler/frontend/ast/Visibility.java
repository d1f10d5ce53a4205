package org.mmlc.compiler.frontend.ast;

/**
 * Module visibility.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    LEXICAL
}

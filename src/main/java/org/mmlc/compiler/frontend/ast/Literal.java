package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * A literal constant. Literals carry their type intrinsically.
 */
public sealed interface Literal extends Term
        permits Literal.IntLit, Literal.FloatLit, Literal.StringLit, Literal.BoolLit, Literal.UnitLit {

    @Override
    default List<Term> children() {
        return List.of();
    }

    @Override
    default Term withChildren(List<Term> children) {
        return this;
    }

    @Override
    default Term withType(TypeSpec type) {
        return this;
    }

    /**
     * An integer literal.
     * @param span The span.
     * @param value The value.
     */
    record IntLit(SourceSpan span, long value) implements Literal {
        @Override
        public TypeSpec typeSpec() {
            return TypeSpec.INT;
        }

        @Override
        public IntLit withSpan(SourceSpan newSpan) {
            return new IntLit(newSpan, value);
        }
    }

    /**
     * A floating point literal.
     * @param span The span.
     * @param value The value.
     */
    record FloatLit(SourceSpan span, double value) implements Literal {
        @Override
        public TypeSpec typeSpec() {
            return TypeSpec.FLOAT;
        }

        @Override
        public FloatLit withSpan(SourceSpan newSpan) {
            return new FloatLit(newSpan, value);
        }
    }

    /**
     * A string literal.
     * @param span The span.
     * @param value The unescaped value.
     */
    record StringLit(SourceSpan span, String value) implements Literal {
        @Override
        public TypeSpec typeSpec() {
            return TypeSpec.STRING;
        }

        @Override
        public StringLit withSpan(SourceSpan newSpan) {
            return new StringLit(newSpan, value);
        }
    }

    /**
     * A boolean literal.
     * @param span The span.
     * @param value The value.
     */
    record BoolLit(SourceSpan span, boolean value) implements Literal {
        @Override
        public TypeSpec typeSpec() {
            return TypeSpec.BOOL;
        }

        @Override
        public BoolLit withSpan(SourceSpan newSpan) {
            return new BoolLit(newSpan, value);
        }
    }

    /**
     * The unit value {@code ()}.
     * @param span The span.
     */
    record UnitLit(SourceSpan span) implements Literal {
        @Override
        public TypeSpec typeSpec() {
            return TypeSpec.UNIT;
        }

        @Override
        public UnitLit withSpan(SourceSpan newSpan) {
            return new UnitLit(newSpan);
        }
    }
}

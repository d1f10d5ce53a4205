package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.List;

/**
 * A name occurrence: a value, function, parameter or operator reference.
 *
 * @param span           The span of the name.
 * @param name           The referenced name.
 * @param resolvedTarget The bound declaration, or {@code null} before (or after failed) resolution.
 * @param typeSpec       The computed type, or {@code null}.
 */
public record Ref(SourceSpan span, String name, ResolvedTarget resolvedTarget, TypeSpec typeSpec) implements Term {

    /**
     * Creates an unresolved reference, the way the parser produces it.
     * @param span The span.
     * @param name The name.
     */
    public Ref(SourceSpan span, String name) {
        this(span, name, null, null);
    }

    /**
     * @return {@code true} if this reference is bound to an operator.
     */
    public boolean isOperator() {
        return resolvedTarget != null && resolvedTarget.kind() == ResolvedTarget.Kind.OPERATOR;
    }

    /**
     * @param target The declaration to bind to.
     * @return A bound copy.
     */
    public Ref withTarget(ResolvedTarget target) {
        return new Ref(span, name, target, typeSpec);
    }

    @Override
    public List<Term> children() {
        return List.of();
    }

    @Override
    public Term withChildren(List<Term> children) {
        return this;
    }

    @Override
    public Ref withSpan(SourceSpan newSpan) {
        return new Ref(newSpan, name, resolvedTarget, typeSpec);
    }

    @Override
    public Ref withType(TypeSpec type) {
        return new Ref(span, name, resolvedTarget, type);
    }
}

package org.mmlc.compiler.diagnostics;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.MemberError;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.internal.i18n.Messages;

/**
 * Every problem the semantic pipeline can report. Each variant carries the span of the
 * offending node and the name of the stage that produced it.
 */
public sealed interface SemanticError permits SemanticError.DuplicateName, SemanticError.UnresolvedRef,
        SemanticError.InvalidExpression, SemanticError.MemberErrorPresent, SemanticError.TypeCheckingError {

    /**
     * @return The span the diagnostic points at.
     */
    SourceSpan span();

    /**
     * @return The name of the stage that reported the error.
     */
    String phase();

    /**
     * @return The rendered, user-facing message.
     */
    String message();

    /**
     * A name declared twice in one namespace, or an operator redeclared with another fixity.
     * @param name The colliding name.
     * @param firstSpan Where the name was first declared.
     * @param duplicateSpan Where it was declared again.
     * @param reason Additional detail, e.g. the conflicting fixities, or {@code null}.
     * @param phase The reporting stage.
     */
    record DuplicateName(String name, SourceSpan firstSpan, SourceSpan duplicateSpan, String reason, String phase)
            implements SemanticError {
        @Override
        public SourceSpan span() {
            return duplicateSpan;
        }

        @Override
        public String message() {
            if (reason != null) {
                return Messages.get("duplicate.conflict", name, firstSpan, reason);
            }
            return Messages.get("duplicate.name", name, firstSpan);
        }
    }

    /**
     * A reference no scope declares.
     * @param ref The reference.
     * @param phase The reporting stage.
     */
    record UnresolvedRef(Ref ref, String phase) implements SemanticError {
        @Override
        public SourceSpan span() {
            return ref.span();
        }

        @Override
        public String message() {
            return Messages.get("ref.unresolved", ref.name());
        }
    }

    /**
     * An expression that cannot be rewritten at all.
     * @param span The expression span.
     * @param detail What is wrong with it.
     * @param phase The reporting stage.
     */
    record InvalidExpression(SourceSpan span, String detail, String phase) implements SemanticError {
        @Override
        public String message() {
            return Messages.get("expression.invalid", detail);
        }
    }

    /**
     * A member placeholder survived until the last gate.
     * @param memberError The placeholder.
     * @param phase The reporting stage.
     */
    record MemberErrorPresent(MemberError memberError, String phase) implements SemanticError {
        @Override
        public SourceSpan span() {
            return memberError.span();
        }

        @Override
        public String message() {
            return Messages.get("member.error", memberError.message());
        }
    }

    /**
     * A type error.
     * @param error The wrapped error.
     */
    record TypeCheckingError(TypeError error) implements SemanticError {
        @Override
        public SourceSpan span() {
            return error.span();
        }

        @Override
        public String phase() {
            return error.phase();
        }

        @Override
        public String message() {
            return error.message();
        }
    }
}

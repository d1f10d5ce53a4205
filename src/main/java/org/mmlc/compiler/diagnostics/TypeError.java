package org.mmlc.compiler.diagnostics;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;
import org.mmlc.compiler.internal.i18n.Messages;

/**
 * Errors found while assigning types. They reach the diagnostic list wrapped in
 * {@link SemanticError.TypeCheckingError}.
 */
public sealed interface TypeError permits TypeError.UnresolvableType, TypeError.InvalidApplication,
        TypeError.TypeMismatch, TypeError.ConditionalBranchMismatch, TypeError.UndefinedTypeRef {

    /**
     * @return The span of the offending node.
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
     * No source determines the type of a node.
     * @param span The node span.
     * @param expected The type the context expected, or {@code null}.
     * @param phase The reporting stage.
     */
    record UnresolvableType(SourceSpan span, TypeSpec expected, String phase) implements TypeError {
        @Override
        public String message() {
            if (expected == null) {
                return Messages.get("type.unresolvable");
            }
            return Messages.get("type.unresolvableExpected", expected);
        }
    }

    /**
     * Something that is not a function was applied, or an operator appears where it cannot
     * be applied.
     * @param span The span of the applied term or operator.
     * @param target A description of the applied value (a value name, a literal or an operator).
     * @param targetType The type of the applied value when known, or {@code null}.
     * @param detail The message key suffix describing the case.
     * @param phase The reporting stage.
     */
    record InvalidApplication(SourceSpan span, String target, TypeSpec targetType, Detail detail, String phase)
            implements TypeError {

        /**
         * The ways an application can be invalid.
         */
        public enum Detail {
            /** A value whose type is not a function was applied to an argument. */
            NOT_A_FUNCTION("application.notAFunction"),
            /** An operator appears where an operand is required. */
            OPERATOR_AS_OPERAND("application.operatorAsOperand"),
            /** A binary operator has no right operand. */
            MISSING_OPERAND("application.missingOperand"),
            /** A prefix-only operator appears between two operands. */
            NOT_BINARY("application.notBinary");

            private final String key;

            Detail(String key) {
                this.key = key;
            }
        }

        @Override
        public String message() {
            return Messages.get(detail.key, target, targetType);
        }
    }

    /**
     * A node's type disagrees with what its context requires.
     * @param span The node span.
     * @param expected The required type.
     * @param actual The computed type.
     * @param phase The reporting stage.
     */
    record TypeMismatch(SourceSpan span, TypeSpec expected, TypeSpec actual, String phase) implements TypeError {
        @Override
        public String message() {
            return Messages.get("type.mismatch", expected, actual);
        }
    }

    /**
     * The two branches of a conditional have incompatible types.
     * @param span The conditional's span.
     * @param trueType The type of the true branch.
     * @param falseType The type of the false branch.
     * @param phase The reporting stage.
     */
    record ConditionalBranchMismatch(SourceSpan span, TypeSpec trueType, TypeSpec falseType, String phase)
            implements TypeError {
        @Override
        public String message() {
            return Messages.get("type.branchMismatch", trueType, falseType);
        }
    }

    /**
     * An annotation or type definition names a type the module does not declare.
     * @param span The span of the annotated declaration.
     * @param name The unknown type name.
     * @param phase The reporting stage.
     */
    record UndefinedTypeRef(SourceSpan span, String name, String phase) implements TypeError {
        @Override
        public String message() {
            return Messages.get("type.undefined", name);
        }
    }
}

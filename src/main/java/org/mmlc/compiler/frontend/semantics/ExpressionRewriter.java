package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.diagnostics.TypeError;
import org.mmlc.compiler.frontend.TreeWalker;
import org.mmlc.compiler.frontend.ast.App;
import org.mmlc.compiler.frontend.ast.Associativity;
import org.mmlc.compiler.frontend.ast.Expr;
import org.mmlc.compiler.frontend.ast.Literal;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.OperatorDef;
import org.mmlc.compiler.frontend.ast.OperatorTable;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.ResolvedTarget;
import org.mmlc.compiler.frontend.ast.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the flat term sequences of expressions into nested applications using
 * precedence climbing.
 * <p>
 * Juxtaposed operands are curried, left-associative function application and bind
 * tighter than any operator. A binary operator use {@code a op b} becomes
 * {@code App(App(op, a), b)}, a prefix use {@code op a} becomes {@code App(op, a)}.
 * Nested expressions are rewritten on their own and stay a single operand of the
 * enclosing expression. Rewriting an already rewritten tree changes nothing.
 */
public final class ExpressionRewriter implements ISemanticPhase {

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        Module module = state.module();
        List<SemanticError> errors = new ArrayList<>();
        Rewrite rewrite = new Rewrite(module.operators(), errors);
        Module rewritten = TreeWalker.mapBodies(module, rewrite::rewriteExpr);
        return state.withModule(rewritten).addErrors(errors);
    }

    /**
     * Position in the term list of one expression.
     */
    private static final class Cursor {
        private final List<Term> terms;
        private int index;

        Cursor(List<Term> terms) {
            this.terms = terms;
        }

        boolean hasNext() {
            return index < terms.size();
        }

        Term peek() {
            return terms.get(index);
        }

        Term next() {
            return terms.get(index++);
        }
    }

    private final class Rewrite {
        private final OperatorTable operators;
        private final List<SemanticError> errors;

        Rewrite(OperatorTable operators, List<SemanticError> errors) {
            this.operators = operators;
            this.errors = errors;
        }

        Expr rewriteExpr(Expr expr) {
            if (expr.terms().isEmpty()) {
                errors.add(new SemanticError.InvalidExpression(expr.span(), "expected an expression, got no terms", name()));
                return expr;
            }
            Term result = parseExpression(new Cursor(expr.terms()), Integer.MIN_VALUE);
            if (result == null) {
                // only stray operators, already reported
                return expr;
            }
            return new Expr(expr.span(), List.of(result), expr.typeSpec());
        }

        private Term rewriteTerm(Term term) {
            if (term instanceof Expr expr) {
                return rewriteExpr(expr);
            }
            List<Term> children = term.children();
            if (children.isEmpty()) {
                return term;
            }
            List<Term> rewritten = new ArrayList<>(children.size());
            for (Term child : children) {
                rewritten.add(rewriteTerm(child));
            }
            return term.withChildren(rewritten);
        }

        /**
         * Parses operands and binary operators whose precedence is at least {@code minPrecedence}.
         */
        private Term parseExpression(Cursor cursor, int minPrecedence) {
            Term lhs = parseApplication(cursor);
            if (lhs == null) {
                return null;
            }
            while (cursor.hasNext()) {
                Ref opRef = (Ref) cursor.peek();
                Optional<OperatorDef> binary = operators.binary(opRef.name());
                if (binary.isEmpty()) {
                    cursor.next();
                    report(opRef, TypeError.InvalidApplication.Detail.NOT_BINARY);
                    OperatorDef prefix = operators.prefix(opRef.name()).orElseThrow();
                    Term operand = parsePrefix(opRef, prefix, cursor);
                    lhs = App.of(lhs, operand);
                    continue;
                }
                OperatorDef op = binary.get();
                if (op.precedence() < minPrecedence) {
                    break;
                }
                cursor.next();
                int nextMin = op.associativity() == Associativity.LEFT ? op.precedence() + 1 : op.precedence();
                Ref specialized = specialize(opRef, 2);
                Term rhs = parseExpression(cursor, nextMin);
                if (rhs == null) {
                    report(opRef, TypeError.InvalidApplication.Detail.MISSING_OPERAND);
                    return App.of(specialized, lhs);
                }
                lhs = App.of(App.of(specialized, lhs), rhs);
            }
            return lhs;
        }

        /**
         * Parses one operand followed by any juxtaposed arguments, stopping at the next operator.
         */
        private Term parseApplication(Cursor cursor) {
            Term head = parseOperand(cursor);
            if (head == null) {
                return null;
            }
            boolean applied = false;
            while (cursor.hasNext() && !isOperator(cursor.peek())) {
                Term arg = autoApply(parseOperand(cursor));
                head = App.of(head, arg);
                applied = true;
            }
            return applied ? head : autoApply(head);
        }

        private Term parseOperand(Cursor cursor) {
            while (cursor.hasNext()) {
                Term term = cursor.next();
                if (!isOperator(term)) {
                    return rewriteTerm(term);
                }
                Ref opRef = (Ref) term;
                Optional<OperatorDef> prefix = operators.prefix(opRef.name());
                if (prefix.isPresent()) {
                    return parsePrefix(opRef, prefix.get(), cursor);
                }
                report(opRef, TypeError.InvalidApplication.Detail.OPERATOR_AS_OPERAND);
            }
            return null;
        }

        private Term parsePrefix(Ref opRef, OperatorDef prefix, Cursor cursor) {
            Ref specialized = specialize(opRef, 1);
            int nextMin = prefix.associativity() == Associativity.LEFT ? prefix.precedence() + 1 : prefix.precedence();
            Term operand = parseExpression(cursor, nextMin);
            if (operand == null) {
                report(opRef, TypeError.InvalidApplication.Detail.MISSING_OPERAND);
                return specialized;
            }
            return App.of(specialized, operand);
        }

        /**
         * A zero-parameter function used as a value is called with {@code ()}.
         */
        private Term autoApply(Term term) {
            if (term instanceof Ref ref && ref.resolvedTarget() != null
                    && ref.resolvedTarget().kind() == ResolvedTarget.Kind.FUNCTION
                    && ref.resolvedTarget().arity() == 0) {
                return App.of(ref, new Literal.UnitLit(ref.span()));
            }
            return term;
        }

        private boolean isOperator(Term term) {
            return term instanceof Ref ref && ref.isOperator();
        }

        private Ref specialize(Ref opRef, int arity) {
            return opRef.withTarget(opRef.resolvedTarget().withArity(arity));
        }

        private void report(Ref opRef, TypeError.InvalidApplication.Detail detail) {
            errors.add(new SemanticError.TypeCheckingError(
                    new TypeError.InvalidApplication(opRef.span(), opRef.name(), null, detail, name())));
        }
    }
}

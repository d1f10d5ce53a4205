package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.diagnostics.TypeError;
import org.mmlc.compiler.diagnostics.TypeError.InvalidApplication.Detail;
import org.mmlc.compiler.frontend.ast.App;
import org.mmlc.compiler.frontend.ast.Associativity;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.testutils.AstFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mmlc.compiler.testutils.AstFixtures.module;
import static org.mmlc.compiler.testutils.AstFixtures.show;

/**
 * Unit tests for {@link ExpressionRewriter}: operator precedence, associativity, prefix
 * operators, juxtaposition and the errors reported for operators in the wrong position.
 */
@Tag("unit")
class ExpressionRewriterTest {

    private AstFixtures ast;

    @BeforeEach
    void setUp() {
        ast = new AstFixtures();
    }

    private String rewrittenValue(Module module, String binding) {
        SemanticPhaseState state = Stages.rewritten(module);
        return show(Stages.binding(state, binding).value());
    }

    @Nested
    @DisplayName("binary operators")
    class Binary {

        @Test
        void higherPrecedenceBindsTighter() {
            // Arrange
            Module module = module(ast.bnd("x", ast.expr(
                    ast.intLit(1), ast.ref("+"), ast.intLit(2), ast.ref("*"), ast.intLit(3))));

            // Act
            String value = rewrittenValue(module, "x");

            // Assert
            assertThat(value).isEqualTo("[((+ 1) ((* 2) 3))]");
        }

        @Test
        void leftAssociativeOperatorsGroupToTheLeft() {
            Module module = module(ast.bnd("x", ast.expr(
                    ast.intLit(10), ast.ref("-"), ast.intLit(4), ast.ref("-"), ast.intLit(3))));

            assertThat(rewrittenValue(module, "x")).isEqualTo("[((- ((- 10) 4)) 3)]");
        }

        @Test
        void rightAssociativeOperatorsGroupToTheRight() {
            Module module = module(ast.bnd("x", ast.expr(
                    ast.intLit(2), ast.ref("^"), ast.intLit(3), ast.ref("^"), ast.intLit(2))));

            assertThat(rewrittenValue(module, "x")).isEqualTo("[((^ 2) ((^ 3) 2))]");
        }

        @Test
        void declaredOperatorUsesItsOwnFixity() {
            // Arrange
            Module module = module(
                    ast.opDef("::", 50, Associativity.RIGHT, List.of(ast.param("h"), ast.param("t")),
                            ast.expr(ast.ref("t"))),
                    ast.bnd("xs", ast.expr(
                            ast.intLit(1), ast.ref("+"), ast.intLit(2), ast.ref("::"),
                            ast.intLit(3), ast.ref("::"), ast.intLit(4))));

            // Act
            SemanticPhaseState state = Stages.rewritten(module);

            // Assert
            assertThat(state.errors()).isEmpty();
            assertThat(show(Stages.binding(state, "xs").value()))
                    .isEqualTo("[((:: ((+ 1) 2)) ((:: 3) 4))]");
        }

        @Test
        void binaryOperatorReferencesAreSpecializedToArityTwo() {
            Module module = module(ast.bnd("x", ast.expr(ast.intLit(1), ast.ref("+"), ast.intLit(2))));

            SemanticPhaseState state = Stages.rewritten(module);

            App app = (App) Stages.binding(state, "x").value().terms().get(0);
            Ref plus = (Ref) app.head();
            assertThat(plus.name()).isEqualTo("+");
            assertThat(plus.resolvedTarget().arity()).isEqualTo(2);
            assertThat(app.arguments()).hasSize(2);
        }

        @Test
        void nestedExpressionStaysOneOperand() {
            Module module = module(ast.bnd("x", ast.expr(
                    ast.expr(ast.intLit(1), ast.ref("+"), ast.intLit(2)), ast.ref("*"), ast.intLit(3))));

            assertThat(rewrittenValue(module, "x")).isEqualTo("[((* [((+ 1) 2)]) 3)]");
        }

        @Test
        void conditionalBranchesAreRewritten() {
            Module module = module(ast.bnd("x", ast.expr(ast.cond(
                    ast.expr(ast.intLit(1), ast.ref("=="), ast.intLit(2)),
                    ast.expr(ast.intLit(1)),
                    ast.expr(ast.intLit(2))))));

            assertThat(rewrittenValue(module, "x")).isEqualTo("[(if [((== 1) 2)] [1] [2])]");
        }
    }

    @Nested
    @DisplayName("prefix operators")
    class Prefix {

        @Test
        void prefixBindsTighterThanBinary() {
            Module module = module(ast.bnd("x", ast.expr(
                    ast.ref("-"), ast.intLit(1), ast.ref("+"), ast.intLit(2))));

            SemanticPhaseState state = Stages.rewritten(module);

            assertThat(state.errors()).isEmpty();
            assertThat(show(Stages.binding(state, "x").value())).isEqualTo("[((+ (- 1)) 2)]");
        }

        @Test
        void sameSymbolIsBinaryBetweenOperandsAndPrefixAfterAnOperator() {
            // Arrange
            Module module = module(ast.bnd("x", ast.expr(
                    ast.intLit(1), ast.ref("-"), ast.ref("-"), ast.intLit(2))));

            // Act
            SemanticPhaseState state = Stages.rewritten(module);

            // Assert
            App outer = (App) Stages.binding(state, "x").value().terms().get(0);
            assertThat(show(outer)).isEqualTo("((- 1) (- 2))");
            assertThat(((Ref) outer.head()).resolvedTarget().arity()).isEqualTo(2);
            App negation = (App) outer.arg();
            assertThat(((Ref) negation.fn()).resolvedTarget().arity()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("function application")
    class Application {

        @Test
        void juxtapositionBindsTighterThanOperators() {
            Module module = module(
                    ast.fn("f", List.of(ast.param("a"), ast.param("b")), null, ast.expr(ast.ref("a"))),
                    ast.bnd("x", ast.expr(ast.ref("f"), ast.intLit(1), ast.intLit(2), ast.ref("+"), ast.intLit(3))));

            assertThat(rewrittenValue(module, "x")).isEqualTo("[((+ ((f 1) 2)) 3)]");
        }

        @Test
        void nullaryFunctionUsedAsValueIsCalledWithUnit() {
            Module module = module(
                    ast.fn("g", List.of(), null, ast.expr(ast.intLit(1))),
                    ast.fn("f", List.of(ast.param("a")), null, ast.expr(ast.ref("a"))),
                    ast.bnd("x", ast.expr(ast.ref("g"), ast.ref("+"), ast.intLit(1))),
                    ast.bnd("y", ast.expr(ast.ref("f"), ast.ref("g"))));

            SemanticPhaseState state = Stages.rewritten(module);

            assertThat(show(Stages.binding(state, "x").value())).isEqualTo("[((+ (g ())) 1)]");
            assertThat(show(Stages.binding(state, "y").value())).isEqualTo("[(f (g ()))]");
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        private TypeError.InvalidApplication singleApplicationError(SemanticPhaseState state) {
            assertThat(state.errors()).hasSize(1);
            SemanticError error = state.errors().get(0);
            assertThat(error).isInstanceOf(SemanticError.TypeCheckingError.class);
            TypeError typeError = ((SemanticError.TypeCheckingError) error).error();
            assertThat(typeError).isInstanceOf(TypeError.InvalidApplication.class);
            return (TypeError.InvalidApplication) typeError;
        }

        @Test
        void binaryOnlyOperatorInOperandPositionIsReported() {
            // Arrange
            Module module = module(ast.bnd("x", ast.expr(ast.ref("*"), ast.intLit(1))));

            // Act
            SemanticPhaseState state = Stages.rewritten(module);

            // Assert
            TypeError.InvalidApplication error = singleApplicationError(state);
            assertThat(error.detail()).isEqualTo(Detail.OPERATOR_AS_OPERAND);
            assertThat(error.target()).isEqualTo("*");
            assertThat(error.message()).contains("Invalid function application").contains("'*'");
            assertThat(show(Stages.binding(state, "x").value())).isEqualTo("[1]");
        }

        @Test
        void missingRightOperandIsReported() {
            Module module = module(ast.bnd("x", ast.expr(ast.intLit(1), ast.ref("+"))));

            SemanticPhaseState state = Stages.rewritten(module);

            assertThat(singleApplicationError(state).detail()).isEqualTo(Detail.MISSING_OPERAND);
            assertThat(show(Stages.binding(state, "x").value())).isEqualTo("[(+ 1)]");
        }

        @Test
        void prefixOnlyOperatorBetweenOperandsIsReportedAndRecovered() {
            Module module = module(ast.bnd("x", ast.expr(ast.intLit(1), ast.ref("not"), ast.boolLit(true))));

            SemanticPhaseState state = Stages.rewritten(module);

            assertThat(singleApplicationError(state).detail()).isEqualTo(Detail.NOT_BINARY);
            assertThat(show(Stages.binding(state, "x").value())).isEqualTo("[(1 (not true))]");
        }

        @Test
        void emptyExpressionIsInvalid() {
            Module module = module(ast.bnd("x", ast.expr()));

            SemanticPhaseState state = Stages.rewritten(module);

            assertThat(state.errors()).singleElement().isInstanceOf(SemanticError.InvalidExpression.class);
        }
    }

    @Test
    void rewritingTwiceChangesNothing() {
        // Arrange
        Module module = module(
                ast.fn("g", List.of(), null, ast.expr(ast.intLit(1))),
                ast.bnd("x", ast.expr(ast.ref("-"), ast.ref("g"), ast.ref("+"), ast.intLit(2), ast.ref("*"),
                        ast.expr(ast.intLit(3), ast.ref("-"), ast.intLit(4)))));
        SemanticPhaseState once = Stages.rewritten(module);

        // Act
        SemanticPhaseState twice = new ExpressionRewriter().apply(once);

        // Assert
        assertThat(once.errors()).isEmpty();
        assertThat(twice.module()).isEqualTo(once.module());
    }
}

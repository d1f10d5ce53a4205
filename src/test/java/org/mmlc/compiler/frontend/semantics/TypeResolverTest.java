package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.diagnostics.TypeError;
import org.mmlc.compiler.frontend.ast.App;
import org.mmlc.compiler.frontend.ast.Block;
import org.mmlc.compiler.frontend.ast.FnDef;
import org.mmlc.compiler.frontend.ast.LocalBinding;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;
import org.mmlc.compiler.testutils.AstFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mmlc.compiler.testutils.AstFixtures.module;

/**
 * Unit tests for {@link TypeResolver}. Modules run through the pipeline up to type
 * resolution so that references are bound and expressions are nested.
 */
@Tag("unit")
class TypeResolverTest {

    private AstFixtures ast;

    @BeforeEach
    void setUp() {
        ast = new AstFixtures();
    }

    @Test
    void operatorApplicationGetsTheOperatorResultType() {
        // Arrange
        Module module = module(ast.bnd("x", ast.expr(ast.intLit(1), ast.ref("+"), ast.intLit(2))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        assertThat(state.errors()).isEmpty();
        App sum = (App) Stages.binding(state, "x").value().terms().get(0);
        assertThat(sum.typeSpec()).isEqualTo(TypeSpec.INT);
        assertThat(sum.fn().typeSpec()).isEqualTo(new TypeSpec.TypeFn(List.of(TypeSpec.INT), TypeSpec.INT));
        assertThat(Stages.binding(state, "x").value().typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void comparisonYieldsBool() {
        Module module = module(ast.bnd("b", ast.expr(
                ast.intLit(1), ast.ref("+"), ast.intLit(2), ast.ref("<"), ast.intLit(4))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(state.errors()).isEmpty();
        assertThat(Stages.binding(state, "b").value().typeSpec()).isEqualTo(TypeSpec.BOOL);
    }

    @Test
    void parameterTypesAreInferredFromTheBody() {
        // Arrange
        Module module = module(
                ast.fn("inc", List.of(ast.param("a")), null, ast.expr(ast.ref("a"), ast.ref("+"), ast.intLit(1))),
                ast.bnd("y", ast.expr(ast.ref("inc"), ast.intLit(41))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        assertThat(state.errors()).isEmpty();
        FnDef inc = (FnDef) state.module().findDecl("inc").orElseThrow();
        assertThat(inc.body().typeSpec()).isEqualTo(TypeSpec.INT);
        assertThat(Stages.binding(state, "y").value().typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void partialApplicationYieldsTheRemainingFunctionType() {
        Module module = module(
                ast.fn("add", List.of(ast.param("a", TypeSpec.INT), ast.param("b", TypeSpec.INT)), TypeSpec.INT,
                        ast.expr(ast.ref("a"), ast.ref("+"), ast.ref("b"))),
                ast.bnd("addOne", ast.expr(ast.ref("add"), ast.intLit(1))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(state.errors()).isEmpty();
        assertThat(Stages.binding(state, "addOne").value().typeSpec())
                .isEqualTo(new TypeSpec.TypeFn(List.of(TypeSpec.INT), TypeSpec.INT));
    }

    @Test
    void laterDeclarationsCanBeUsedBeforeTheyAppear() {
        Module module = module(
                ast.bnd("y", ast.expr(ast.ref("twice"), ast.intLit(2))),
                ast.fn("twice", List.of(ast.param("n", TypeSpec.INT)), TypeSpec.INT,
                        ast.expr(ast.ref("n"), ast.ref("*"), ast.intLit(2))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(state.errors()).isEmpty();
        assertThat(Stages.binding(state, "y").value().typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void genericFunctionIsInstantiatedPerUse() {
        // Arrange
        Module module = module(
                ast.fn("id", List.of(ast.param("v")), null, ast.expr(ast.ref("v"))),
                ast.bnd("i", ast.expr(ast.ref("id"), ast.intLit(1))),
                ast.bnd("b", ast.expr(ast.ref("id"), ast.boolLit(true))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        assertThat(state.errors()).isEmpty();
        assertThat(Stages.binding(state, "i").value().typeSpec()).isEqualTo(TypeSpec.INT);
        assertThat(Stages.binding(state, "b").value().typeSpec()).isEqualTo(TypeSpec.BOOL);
    }

    @Test
    void applyingANonFunctionValueNamesTheValue() {
        // Arrange
        Module module = module(
                ast.bnd("f", ast.expr(ast.intLit(1))),
                ast.bnd("y", ast.expr(ast.ref("f"), ast.intLit(2))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        List<TypeError> errors = Stages.typeErrors(state);
        assertThat(errors).singleElement().isInstanceOf(TypeError.InvalidApplication.class);
        TypeError.InvalidApplication error = (TypeError.InvalidApplication) errors.get(0);
        assertThat(error.detail()).isEqualTo(TypeError.InvalidApplication.Detail.NOT_A_FUNCTION);
        assertThat(error.targetType()).isEqualTo(TypeSpec.INT);
        assertThat(error.message())
                .contains("Invalid function application")
                .contains("value 'f'")
                .contains("Int")
                .doesNotContain("type 'f'");
    }

    @Test
    void applyingABlockLocalValueIsReported() {
        Module module = module(ast.bnd("y", ast.expr(ast.block(
                ast.expr(ast.ref("f"), ast.intLit(2)),
                ast.let("f", ast.expr(ast.intLit(1)))))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(Stages.typeErrors(state)).singleElement()
                .satisfies(e -> assertThat(e.message()).contains("value 'f'"));
    }

    @Test
    void annotationMismatchIsReported() {
        Module module = module(ast.bnd("b", TypeSpec.BOOL, ast.expr(ast.intLit(1))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(Stages.typeErrors(state)).singleElement().isInstanceOfSatisfying(TypeError.TypeMismatch.class,
                mismatch -> {
                    assertThat(mismatch.expected()).isEqualTo(TypeSpec.BOOL);
                    assertThat(mismatch.actual()).isEqualTo(TypeSpec.INT);
                });
    }

    @Test
    void wrongArgumentTypeIsReportedAtTheArgument() {
        // Arrange
        Module module = module(ast.bnd("x", ast.expr(ast.intLit(1), ast.ref("+"), ast.boolLit(true))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        assertThat(Stages.typeErrors(state)).singleElement().isInstanceOfSatisfying(TypeError.TypeMismatch.class,
                mismatch -> {
                    assertThat(mismatch.expected()).isEqualTo(TypeSpec.INT);
                    assertThat(mismatch.actual()).isEqualTo(TypeSpec.BOOL);
                });
    }

    @Test
    void conditionalBranchesMustAgree() {
        Module module = module(ast.bnd("x", ast.expr(ast.cond(
                ast.expr(ast.boolLit(true)), ast.expr(ast.intLit(1)), ast.expr(ast.boolLit(false))))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(Stages.typeErrors(state)).singleElement()
                .isInstanceOf(TypeError.ConditionalBranchMismatch.class);
    }

    @Test
    void conditionMustBeBool() {
        Module module = module(ast.bnd("x", ast.expr(ast.cond(
                ast.expr(ast.intLit(0)), ast.expr(ast.intLit(1)), ast.expr(ast.intLit(2))))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(Stages.typeErrors(state)).singleElement().isInstanceOf(TypeError.TypeMismatch.class);
        assertThat(Stages.binding(state, "x").value().typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void holeTakesTheExpectedType() {
        Module module = module(ast.bnd("x", TypeSpec.INT, ast.expr(ast.hole())));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(state.errors()).isEmpty();
        assertThat(Stages.binding(state, "x").value().terms().get(0).typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void holeWithoutContextIsUnresolvable() {
        Module module = module(ast.bnd("x", ast.expr(ast.hole())));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(Stages.typeErrors(state)).singleElement().isInstanceOf(TypeError.UnresolvableType.class);
    }

    @Test
    void blockLocalsAreTypedInOrder() {
        // Arrange
        Module module = module(ast.bnd("y", ast.expr(ast.block(
                ast.expr(ast.ref("b"), ast.ref("*"), ast.intLit(2)),
                ast.let("a", ast.expr(ast.intLit(1))),
                ast.let("b", ast.expr(ast.ref("a"), ast.ref("+"), ast.intLit(1)))))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        assertThat(state.errors()).isEmpty();
        Block block = (Block) Stages.binding(state, "y").value().terms().get(0);
        assertThat(block.typeSpec()).isEqualTo(TypeSpec.INT);
        assertThat(block.bindings().get(1).value().typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void lambdaGetsAFunctionType() {
        Module module = module(ast.bnd("f", ast.expr(ast.lambda(
                ast.expr(ast.ref("n"), ast.ref("+"), ast.intLit(1)), ast.param("n")))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(state.errors()).isEmpty();
        assertThat(Stages.binding(state, "f").value().typeSpec())
                .isEqualTo(new TypeSpec.TypeFn(List.of(TypeSpec.INT), TypeSpec.INT));
    }

    @Test
    void unresolvedReferenceCausesNoFollowUpTypeError() {
        // Arrange
        Module module = module(ast.bnd("x", ast.expr(ast.ref("missing"), ast.ref("+"), ast.intLit(1))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        assertThat(state.errors()).singleElement().isInstanceOf(SemanticError.UnresolvedRef.class);
        App sum = (App) Stages.binding(state, "x").value().terms().get(0);
        Ref missing = (Ref) ((App) sum.fn()).arg();
        assertThat(missing.typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void multiParameterFunctionCanBePassedToAHigherOrderFunction() {
        // Arrange
        Module module = module(
                ast.fn("apply", List.of(ast.param("f"), ast.param("x"), ast.param("y")), null,
                        ast.expr(ast.ref("f"), ast.ref("x"), ast.ref("y"))),
                ast.fn("add", List.of(ast.param("a", TypeSpec.INT), ast.param("b", TypeSpec.INT)), TypeSpec.INT,
                        ast.expr(ast.ref("a"), ast.ref("+"), ast.ref("b"))),
                ast.bnd("z", ast.expr(ast.ref("apply"), ast.ref("add"), ast.intLit(1), ast.intLit(2))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        assertThat(state.errors()).isEmpty();
        assertThat(Stages.binding(state, "z").value().typeSpec()).isEqualTo(TypeSpec.INT);
    }

    @Test
    void curriedFunctionArgumentStillRejectsWrongTypes() {
        Module module = module(
                ast.fn("apply", List.of(ast.param("f"), ast.param("x"), ast.param("y")), null,
                        ast.expr(ast.ref("f"), ast.ref("x"), ast.ref("y"))),
                ast.fn("add", List.of(ast.param("a", TypeSpec.INT), ast.param("b", TypeSpec.INT)), TypeSpec.INT,
                        ast.expr(ast.ref("a"), ast.ref("+"), ast.ref("b"))),
                ast.bnd("z", ast.expr(ast.ref("apply"), ast.ref("add"), ast.intLit(1), ast.boolLit(true))));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(Stages.typeErrors(state)).singleElement().isInstanceOf(TypeError.TypeMismatch.class);
    }

    @Test
    void annotationNamingAnUndeclaredTypeIsReported() {
        // Arrange
        TypeSpec foo = new TypeSpec.TypeRef("Foo");
        Module module = module(ast.fn("id", List.of(ast.param("a", foo)), foo, ast.expr(ast.ref("a"))));

        // Act
        SemanticPhaseState state = Stages.typed(module);

        // Assert
        List<TypeError> errors = Stages.typeErrors(state);
        assertThat(errors).hasSize(2).allSatisfy(e -> {
            assertThat(e).isInstanceOf(TypeError.UndefinedTypeRef.class);
            assertThat(((TypeError.UndefinedTypeRef) e).name()).isEqualTo("Foo");
            assertThat(e.message()).isEqualTo("Undefined type 'Foo'");
        });
    }

    @Test
    void undeclaredTypesInsideBodiesAndStructsAreReported() {
        Module module = module(
                ast.struct("Wrapper", AstFixtures.field("inner", new TypeSpec.TypeRef("Missing"))),
                ast.bnd("y", ast.expr(ast.block(
                        ast.expr(ast.ref("a")),
                        new LocalBinding(ast.span(), "a", ast.expr(ast.intLit(1)),
                                new TypeSpec.TypeRef("Nope"))))));

        SemanticPhaseState state = Stages.typed(module);

        List<String> undefined = Stages.typeErrors(state).stream()
                .filter(TypeError.UndefinedTypeRef.class::isInstance)
                .map(e -> ((TypeError.UndefinedTypeRef) e).name())
                .toList();
        assertThat(undefined).containsExactlyInAnyOrder("Missing", "Nope");
    }

    @Test
    void declaredAndBasicTypesAreKnown() {
        Module module = module(
                ast.struct("Point", AstFixtures.field("x", TypeSpec.INT)),
                ast.fn("origin", List.of(ast.param("s", TypeSpec.STRING)), new TypeSpec.TypeRef("Point"),
                        ast.expr(ast.hole())));

        SemanticPhaseState state = Stages.typed(module);

        assertThat(state.errors()).isEmpty();
    }
}

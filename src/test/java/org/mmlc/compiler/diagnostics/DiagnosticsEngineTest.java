package org.mmlc.compiler.diagnostics;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DiagnosticsEngine} ordering and rendering.
 */
@Tag("unit")
class DiagnosticsEngineTest {

    private static final String PHASE = "org.mmlc.compiler.frontend.semantics.RefResolver";

    private static SemanticError unresolved(String name, int line, int col) {
        return new SemanticError.UnresolvedRef(new Ref(SourceSpan.onLine("a.mml", line, col, col + name.length()), name),
                PHASE);
    }

    @Test
    void sortedOrdersBySourcePosition() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.report(unresolved("c", 3, 1));
        diagnostics.report(unresolved("a", 1, 5));
        diagnostics.report(unresolved("b", 1, 9));

        // Act
        List<SemanticError> sorted = diagnostics.sorted();

        // Assert
        assertThat(sorted).extracting(e -> ((SemanticError.UnresolvedRef) e).ref().name())
                .containsExactly("a", "b", "c");
    }

    @Test
    void errorsAtTheSameSpanKeepReportingOrder() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        SourceSpan span = SourceSpan.onLine("a.mml", 2, 1, 4);
        SemanticError mismatch = new SemanticError.TypeCheckingError(
                new TypeError.TypeMismatch(span, TypeSpec.INT, TypeSpec.BOOL, "TypeResolver"));
        SemanticError invalid = new SemanticError.InvalidExpression(span, "no terms", "ExpressionRewriter");

        diagnostics.reportAll(List.of(mismatch, invalid));

        assertThat(diagnostics.sorted()).containsExactly(mismatch, invalid);
    }

    @Test
    void summaryRendersOneLinePerError() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.report(unresolved("late", 7, 3));
        diagnostics.report(unresolved("early", 2, 1));

        // Act
        String summary = diagnostics.summary();

        // Assert
        assertThat(summary).isEqualTo(
                "[ERROR] a.mml:2:1: Undefined reference 'early' (RefResolver)\n"
                        + "[ERROR] a.mml:7:3: Undefined reference 'late' (RefResolver)");
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.count()).isEqualTo(2);
    }

    @Test
    void emptyEngineHasNoErrors() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.summary()).isEmpty();
    }

    @Test
    void typeErrorMessagesRenderTypes() {
        SourceSpan span = SourceSpan.onLine("a.mml", 1, 1, 2);

        assertThat(new TypeError.TypeMismatch(span, TypeSpec.INT,
                new TypeSpec.TypeFn(List.of(TypeSpec.INT), TypeSpec.BOOL), "p").message())
                .isEqualTo("Type mismatch: expected Int, got Int -> Bool");
        assertThat(new TypeError.ConditionalBranchMismatch(span, TypeSpec.INT, TypeSpec.STRING, "p").message())
                .isEqualTo("Conditional branches have different types: Int and String");
        assertThat(new TypeError.UnresolvableType(span, TypeSpec.BOOL, "p").message())
                .isEqualTo("Unable to infer type, expected Bool");
    }
}

package org.mmlc.compiler.internal.i18n;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.Expr;
import org.mmlc.compiler.frontend.ast.Literal;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.MissingResourceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Messages}.
 */
@Tag("unit")
class MessagesTest {

    private static final SourceSpan SPAN = SourceSpan.onLine("m.mml", 3, 7, 9);

    @Test
    void typesAreRenderedInTheirSourceForm() {
        TypeSpec fn = new TypeSpec.TypeFn(List.of(TypeSpec.INT, TypeSpec.INT), TypeSpec.BOOL);

        assertThat(Messages.get("type.mismatch", fn, TypeSpec.INT))
                .isEqualTo("Type mismatch: expected Int -> Int -> Bool, got Int");
    }

    @Test
    void spansAreRenderedAsFileLineColumn() {
        assertThat(Messages.get("duplicate.name", "x", SPAN))
                .isEqualTo("Duplicate name 'x', first defined at m.mml:3:7");
    }

    @Test
    void numbersAreNotLocaleFormatted() {
        assertThat(Messages.get("target.literal", 1234567L)).isEqualTo("literal 1234567");
    }

    @Test
    void unknownTypeIsRenderedAsQuestionMark() {
        assertThat(Messages.get("application.notAFunction", "value 'f'", null))
                .contains("has type ?");
    }

    @Test
    void missingKeyIsAProgrammingError() {
        assertThatThrownBy(() -> Messages.get("no.such.key"))
                .isInstanceOf(MissingResourceException.class);
    }

    @Test
    void applicationTargetsAreDescribedByKind() {
        assertThat(Messages.applicationTarget(new Ref(SPAN, "f"))).isEqualTo("value 'f'");
        assertThat(Messages.applicationTarget(new Literal.IntLit(SPAN, 3))).isEqualTo("literal 3");
        assertThat(Messages.applicationTarget(new Literal.StringLit(SPAN, "hi"))).isEqualTo("literal \"hi\"");
        assertThat(Messages.applicationTarget(new Expr(SPAN, List.of()))).isEqualTo("expression");
    }
}

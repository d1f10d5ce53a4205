package org.mmlc.compiler.frontend;

import org.mmlc.compiler.frontend.ast.Expr;
import org.mmlc.compiler.frontend.ast.Literal;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.Term;
import org.mmlc.compiler.testutils.AstFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mmlc.compiler.testutils.AstFixtures.module;
import static org.mmlc.compiler.testutils.AstFixtures.show;

@Tag("unit")
class TreeWalkerTest {

    private final AstFixtures ast = new AstFixtures();

    @Test
    void walkVisitsParentsBeforeChildrenAcrossAllBodies() {
        // Arrange
        Module module = module(
                ast.fn("f", List.of(ast.param("a")), null, ast.expr(ast.ref("a"))),
                ast.bnd("x", ast.expr(ast.ref("f"), ast.expr(ast.ref("g")))),
                ast.struct("Unit"));
        List<String> seen = new ArrayList<>();
        Map<Class<? extends Term>, Consumer<Term>> handlers = Map.of(
                Ref.class, t -> seen.add(((Ref) t).name()),
                Expr.class, t -> seen.add("expr"));

        // Act
        new TreeWalker(handlers).walk(module);

        // Assert
        assertThat(seen).containsExactly("expr", "a", "expr", "f", "expr", "g");
    }

    @Test
    void transformRebuildsOnlyChangedNodes() {
        // Arrange
        Expr untouched = ast.expr(ast.ref("a"));
        Expr root = ast.expr(untouched, ast.intLit(1));

        // Act
        Term result = TreeWalker.transform(root,
                t -> t instanceof Literal.IntLit lit ? new Literal.IntLit(lit.span(), lit.value() + 1) : t);

        // Assert
        assertThat(show(result)).isEqualTo("[[a] 2]");
        assertThat(((Expr) result).terms().get(0)).isSameAs(untouched);
    }

    @Test
    void transformWithoutChangesReturnsTheSameTree() {
        Expr root = ast.expr(ast.ref("a"), ast.expr(ast.ref("b"), ast.intLit(3)));

        assertThat(TreeWalker.transform(root, t -> t)).isSameAs(root);
    }
}

package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A curried application of one argument. {@code f x y} is {@code App(App(f, x), y)} and
 * the binary operator use {@code a + b} is {@code App(App(+, a), b)}.
 *
 * @param span     The span covering function and argument.
 * @param fn       The applied term.
 * @param arg      The argument.
 * @param typeSpec The computed type, or {@code null}.
 */
public record App(SourceSpan span, Term fn, Term arg, TypeSpec typeSpec) implements Term {

    /**
     * Creates an untyped application spanning both terms.
     * @param fn The applied term.
     * @param arg The argument.
     * @return The application.
     */
    public static App of(Term fn, Term arg) {
        return new App(SourceSpan.covering(fn.span(), arg.span()), fn, arg, null);
    }

    /**
     * @return The innermost applied term of a curried chain.
     */
    public Term head() {
        Term current = fn;
        while (current instanceof App app) {
            current = app.fn();
        }
        return current;
    }

    /**
     * @return All arguments of a curried chain, first argument first.
     */
    public List<Term> arguments() {
        List<Term> args = new ArrayList<>();
        Term current = this;
        while (current instanceof App app) {
            args.add(app.arg());
            current = app.fn();
        }
        Collections.reverse(args);
        return args;
    }

    @Override
    public List<Term> children() {
        return List.of(fn, arg);
    }

    @Override
    public App withChildren(List<Term> children) {
        return new App(span, children.get(0), children.get(1), typeSpec);
    }

    @Override
    public App withSpan(SourceSpan newSpan) {
        return new App(newSpan, fn, arg, typeSpec);
    }

    @Override
    public App withType(TypeSpec type) {
        return new App(span, fn, arg, type);
    }
}

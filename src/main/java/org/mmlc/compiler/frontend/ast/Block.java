package org.mmlc.compiler.frontend.ast;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequence of local bindings followed by a result, e.g. {@code let f = 1; f 2}.
 * All bindings of one block live in the same scope; each binding sees the ones before it.
 *
 * @param span     The span.
 * @param bindings The bindings in source order.
 * @param result   The result term.
 * @param typeSpec The computed type, or {@code null}.
 */
public record Block(SourceSpan span, List<LocalBinding> bindings, Term result, TypeSpec typeSpec) implements Term {

    public Block {
        bindings = List.copyOf(bindings);
    }

    /**
     * Children are the binding values in order, followed by the result.
     */
    @Override
    public List<Term> children() {
        List<Term> children = new ArrayList<>(bindings.size() + 1);
        bindings.forEach(b -> children.add(b.value()));
        children.add(result);
        return children;
    }

    @Override
    public Block withChildren(List<Term> children) {
        List<LocalBinding> rebuilt = new ArrayList<>(bindings.size());
        for (int i = 0; i < bindings.size(); i++) {
            rebuilt.add(bindings.get(i).withValue(children.get(i)));
        }
        return new Block(span, rebuilt, children.get(bindings.size()), typeSpec);
    }

    @Override
    public Block withSpan(SourceSpan newSpan) {
        return new Block(newSpan, bindings, result, typeSpec);
    }

    @Override
    public Block withType(TypeSpec type) {
        return new Block(span, bindings, result, type);
    }
}

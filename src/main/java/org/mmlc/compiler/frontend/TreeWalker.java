package org.mmlc.compiler.frontend;

import org.mmlc.compiler.frontend.ast.Bnd;
import org.mmlc.compiler.frontend.ast.Expr;
import org.mmlc.compiler.frontend.ast.FnDef;
import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.OpDef;
import org.mmlc.compiler.frontend.ast.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A generic class for traversing expression trees.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between compiler stages and the AST structure.
 */
public class TreeWalker {

    private final Map<Class<? extends Term>, Consumer<Term>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from term classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends Term>, Consumer<Term>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks the bodies of all members of a module.
     * @param module The module to walk.
     */
    public void walk(Module module) {
        for (Member member : module.members()) {
            Expr body = bodyOf(member);
            if (body != null) {
                walk(body);
            }
        }
    }

    /**
     * Walks a single term and its children recursively, parents first.
     * @param term The term to walk.
     */
    public void walk(Term term) {
        if (term == null) {
            return;
        }

        handlers.getOrDefault(term.getClass(), t -> {}).accept(term);

        for (Term child : term.children()) {
            walk(child);
        }
    }

    /**
     * Transforms a tree bottom-up: children are transformed first, the node is rebuilt
     * only if a child changed, then the function is applied to the (rebuilt) node.
     * @param term The root term.
     * @param function The per-node transformation.
     * @return The transformed term (may be the same instance).
     */
    public static Term transform(Term term, UnaryOperator<Term> function) {
        List<Term> children = term.children();
        List<Term> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (Term child : children) {
            Term transformedChild = transform(child, function);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        Term rebuilt = childrenChanged ? term.withChildren(transformedChildren) : term;
        return function.apply(rebuilt);
    }

    /**
     * Replaces the body of every function, binding and operator of a module.
     * @param module The module.
     * @param function Maps an old body to the new one.
     * @return A module with the transformed bodies.
     */
    public static Module mapBodies(Module module, UnaryOperator<Expr> function) {
        List<Member> members = new ArrayList<>(module.members().size());
        for (Member member : module.members()) {
            members.add(mapBody(member, function));
        }
        return module.withMembers(members);
    }

    /**
     * Replaces the body of a single member, leaving members without a body untouched.
     * @param member The member.
     * @param function Maps the old body to the new one.
     * @return The member with its body transformed.
     */
    public static Member mapBody(Member member, UnaryOperator<Expr> function) {
        if (member instanceof FnDef fn) {
            return fn.withBody(function.apply(fn.body()));
        }
        if (member instanceof Bnd bnd) {
            return bnd.withValue(function.apply(bnd.value()));
        }
        if (member instanceof OpDef op) {
            return op.withBody(function.apply(op.body()));
        }
        return member;
    }

    /**
     * @param member A member.
     * @return Its body, or {@code null} for members without one.
     */
    public static Expr bodyOf(Member member) {
        if (member instanceof FnDef fn) return fn.body();
        if (member instanceof Bnd bnd) return bnd.value();
        if (member instanceof OpDef op) return op.body();
        return null;
    }
}

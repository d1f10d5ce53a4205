package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A substitution of type variables built up by unification. One instance is used per
 * member; nothing is generalized.
 */
final class Unifier {

    private final Map<String, TypeSpec> bindings = new HashMap<>();

    /**
     * Follows variable bindings until a non-variable or an unbound variable is reached.
     */
    TypeSpec resolve(TypeSpec type) {
        TypeSpec current = type;
        while (current instanceof TypeSpec.TypeVariable var && bindings.containsKey(var.name())) {
            current = bindings.get(var.name());
        }
        return current;
    }

    /**
     * Applies the substitution everywhere inside a type.
     */
    TypeSpec zonk(TypeSpec type) {
        TypeSpec resolved = resolve(type);
        if (resolved instanceof TypeSpec.TypeFn fn) {
            List<TypeSpec> params = new ArrayList<>(fn.params().size());
            for (TypeSpec param : fn.params()) {
                params.add(zonk(param));
            }
            return new TypeSpec.TypeFn(params, zonk(fn.result()));
        }
        return resolved;
    }

    /**
     * Makes two types equal by binding variables.
     * @return {@code false} if the types cannot be made equal; bindings made before the
     * conflict was found are kept.
     */
    boolean unify(TypeSpec a, TypeSpec b) {
        TypeSpec left = resolve(a);
        TypeSpec right = resolve(b);
        if (left.equals(right)) {
            return true;
        }
        if (left instanceof TypeSpec.TypeVariable var) {
            return bind(var, right);
        }
        if (right instanceof TypeSpec.TypeVariable var) {
            return bind(var, left);
        }
        if (left instanceof TypeSpec.TypeFn lf && right instanceof TypeSpec.TypeFn rf) {
            if (lf.params().size() != rf.params().size()) {
                // a -> b -> r and (a -> (b -> r)) denote the same curried function
                if (lf.params().isEmpty() || rf.params().isEmpty()) {
                    return false;
                }
                return unify(lf.params().get(0), rf.params().get(0)) && unify(dropFirst(lf), dropFirst(rf));
            }
            for (int i = 0; i < lf.params().size(); i++) {
                if (!unify(lf.params().get(i), rf.params().get(i))) {
                    return false;
                }
            }
            return unify(lf.result(), rf.result());
        }
        return false;
    }

    private static TypeSpec dropFirst(TypeSpec.TypeFn fn) {
        if (fn.params().size() == 1) {
            return fn.result();
        }
        return new TypeSpec.TypeFn(fn.params().subList(1, fn.params().size()), fn.result());
    }

    private boolean bind(TypeSpec.TypeVariable var, TypeSpec type) {
        if (occurs(var.name(), type)) {
            return false;
        }
        bindings.put(var.name(), type);
        return true;
    }

    private boolean occurs(String name, TypeSpec type) {
        TypeSpec resolved = resolve(type);
        if (resolved instanceof TypeSpec.TypeVariable var) {
            return var.name().equals(name);
        }
        if (resolved instanceof TypeSpec.TypeFn fn) {
            return fn.params().stream().anyMatch(p -> occurs(name, p)) || occurs(name, fn.result());
        }
        return false;
    }
}

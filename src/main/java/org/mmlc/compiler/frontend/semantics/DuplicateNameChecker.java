package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.frontend.ast.Bnd;
import org.mmlc.compiler.frontend.ast.Decl;
import org.mmlc.compiler.frontend.ast.FnDef;
import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.OpDef;
import org.mmlc.compiler.frontend.ast.TypeDef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports top-level declarations whose name is already taken in the same namespace.
 * <p>
 * Namespaces: functions and bindings share the value namespace, types have their own,
 * and operators are keyed by name and arity. Every later occurrence is reported against
 * the first one; the members themselves are kept and references resolve to the first.
 * Local scopes are left to {@link RefResolver}.
 */
public final class DuplicateNameChecker implements ISemanticPhase {

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        Map<String, Decl> firstByKey = new HashMap<>();
        List<SemanticError> errors = new ArrayList<>();

        for (Member member : state.module().members()) {
            if (!(member instanceof Decl decl)) {
                continue;
            }
            Decl first = firstByKey.putIfAbsent(namespaceKey(decl), decl);
            if (first != null) {
                errors.add(new SemanticError.DuplicateName(decl.name(), first.span(), decl.span(), null, name()));
            }
        }
        return state.addErrors(errors);
    }

    private static String namespaceKey(Decl decl) {
        if (decl instanceof FnDef || decl instanceof Bnd) {
            return "value:" + decl.name();
        }
        if (decl instanceof TypeDef) {
            return "type:" + decl.name();
        }
        OpDef op = (OpDef) decl;
        return "op:" + op.name() + "/" + op.arity();
    }
}

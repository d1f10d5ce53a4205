package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.MemberError;

import java.util.ArrayList;
import java.util.List;

/**
 * The last gate before code generation: every member placeholder that is still present
 * becomes a fatal error.
 */
public final class MemberErrorChecker implements ISemanticPhase {

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        List<SemanticError> errors = new ArrayList<>();
        for (Member member : state.module().members()) {
            if (member instanceof MemberError error) {
                errors.add(new SemanticError.MemberErrorPresent(error, name()));
            }
        }
        return state.addErrors(errors);
    }

    @Override
    public boolean haltsOnError() {
        return true;
    }
}

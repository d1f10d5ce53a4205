package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.frontend.ast.Module;

import java.util.ArrayList;
import java.util.List;

/**
 * The snapshot passed from one semantic stage to the next: the current module and every
 * error reported so far.
 *
 * @param module The module as left by the previous stage.
 * @param errors The accumulated errors, in reporting order.
 */
public record SemanticPhaseState(Module module, List<SemanticError> errors) {

    public SemanticPhaseState {
        errors = List.copyOf(errors);
    }

    /**
     * @param module The parsed module.
     * @return A state without errors.
     */
    public static SemanticPhaseState initial(Module module) {
        return new SemanticPhaseState(module, List.of());
    }

    /**
     * @param newModule The module produced by a stage.
     * @return A copy holding the given module.
     */
    public SemanticPhaseState withModule(Module newModule) {
        return new SemanticPhaseState(newModule, errors);
    }

    /**
     * @param newErrors Errors to append.
     * @return A copy with the errors appended.
     */
    public SemanticPhaseState addErrors(List<? extends SemanticError> newErrors) {
        if (newErrors.isEmpty()) {
            return this;
        }
        List<SemanticError> all = new ArrayList<>(errors);
        all.addAll(newErrors);
        return new SemanticPhaseState(module, all);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

package org.mmlc.compiler.frontend.semantics;

/**
 * One stage of semantic analysis. A stage never mutates its input: it returns a new
 * state holding the transformed module and any errors it found.
 */
public interface ISemanticPhase {

    /**
     * @return The stage identity recorded on every error the stage reports.
     */
    default String name() {
        return getClass().getName();
    }

    /**
     * Runs the stage.
     * @param state The state left by the previous stage.
     * @return The new state.
     */
    SemanticPhaseState apply(SemanticPhaseState state);

    /**
     * @return {@code true} if analysis must stop when this stage reports an error.
     */
    default boolean haltsOnError() {
        return false;
    }
}

package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.config.CompilerConfig;
import org.mmlc.compiler.diagnostics.CompilerLogger;
import org.mmlc.compiler.frontend.ast.Module;

import java.util.ArrayList;
import java.util.List;

/**
 * Performs semantic analysis on a parsed module by running the registered stages in
 * order. Every stage sees the module left by the previous one; errors accumulate.
 * Analysis stops early only after a stage that {@linkplain ISemanticPhase#haltsOnError() halts on error}
 * reported something.
 */
public class SemanticAnalyzer {

    private final List<ISemanticPhase> phases = new ArrayList<>();

    /**
     * Registers a stage after the ones already registered.
     * @param phase The stage.
     */
    public void register(ISemanticPhase phase) {
        phases.add(phase);
    }

    /**
     * @return The registered stages in execution order.
     */
    public List<ISemanticPhase> phases() {
        return List.copyOf(phases);
    }

    /**
     * Creates an analyzer with the standard stage order: basic types, operator registry,
     * duplicate names, reference resolution, expression rewriting, type resolution,
     * simplification and the member-error gate.
     * @param config The compiler settings providing the built-in operators.
     * @return A new analyzer.
     */
    public static SemanticAnalyzer withDefaults(CompilerConfig config) {
        SemanticAnalyzer analyzer = new SemanticAnalyzer();
        analyzer.register(new BasicTypesInjector());
        analyzer.register(new OperatorRegistry(config.builtinOperators()));
        analyzer.register(new DuplicateNameChecker());
        analyzer.register(new RefResolver());
        analyzer.register(new ExpressionRewriter());
        analyzer.register(new TypeResolver());
        analyzer.register(new Simplifier());
        analyzer.register(new MemberErrorChecker());
        return analyzer;
    }

    /**
     * Runs all stages on a module.
     * @param module The parsed module.
     * @return The final state: the rewritten module and every error found.
     */
    public SemanticPhaseState analyze(Module module) {
        SemanticPhaseState state = SemanticPhaseState.initial(module);
        for (ISemanticPhase phase : phases) {
            int before = state.errors().size();
            long start = System.nanoTime();
            state = phase.apply(state);
            long elapsedMicros = (System.nanoTime() - start) / 1_000;
            int reported = state.errors().size() - before;
            CompilerLogger.stageFinished(module.name(), phase.getClass().getSimpleName(), elapsedMicros, reported);
            if (reported > 0 && phase.haltsOnError()) {
                CompilerLogger.pipelineHalted(module.name(), phase.getClass().getSimpleName());
                break;
            }
        }
        return state;
    }
}

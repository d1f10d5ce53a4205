package org.mmlc.compiler;

import com.typesafe.config.Config;
import org.mmlc.compiler.api.CompilationException;
import org.mmlc.compiler.api.CompiledModule;
import org.mmlc.compiler.api.ICompiler;
import org.mmlc.compiler.api.ModuleOutcome;
import org.mmlc.compiler.backend.abi.AbiRegistry;
import org.mmlc.compiler.backend.abi.AbiStrategy;
import org.mmlc.compiler.backend.abi.StructLayoutTable;
import org.mmlc.compiler.backend.abi.TargetAbi;
import org.mmlc.compiler.config.CompilerConfig;
import org.mmlc.compiler.config.LoggingConfigurator;
import org.mmlc.compiler.diagnostics.CompilerLogger;
import org.mmlc.compiler.diagnostics.DiagnosticsEngine;
import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.semantics.SemanticAnalyzer;
import org.mmlc.compiler.frontend.semantics.SemanticPhaseState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * The main compiler implementation. It runs semantic analysis on a parsed module and,
 * if no diagnostic was reported, builds the struct layout table and selects the ABI
 * strategy of the configured target.
 * <p>
 * A single module is compiled on the calling thread. {@link #compileAll(List)} compiles
 * independent modules on a fixed pool; the stages share no mutable state.
 */
public class Compiler implements ICompiler {

    private final CompilerConfig config;
    private final AbiRegistry abiRegistry;

    /**
     * Creates a compiler from the loaded configuration and applies its logging settings.
     * @return A new compiler.
     */
    public static Compiler create() {
        Config loaded = CompilerConfig.loadConfig();
        LoggingConfigurator.configure(loaded);
        return new Compiler(CompilerConfig.fromConfig(loaded));
    }

    /**
     * @param config The compiler settings.
     */
    public Compiler(CompilerConfig config) {
        this(config, AbiRegistry.initializeWithDefaults());
    }

    /**
     * @param config The compiler settings.
     * @param abiRegistry The struct lowering rules per target.
     */
    public Compiler(CompilerConfig config, AbiRegistry abiRegistry) {
        this.config = config;
        this.abiRegistry = abiRegistry;
        CompilerLogger.setLevel(config.verbosity());
    }

    @Override
    public void setVerbosity(int level) {
        CompilerLogger.setLevel(level);
    }

    @Override
    public CompiledModule compile(Module module) throws CompilationException {
        CompilerLogger.moduleStarted(module.name(), module.members().size());
        SemanticPhaseState state = SemanticAnalyzer.withDefaults(config).analyze(module);

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.reportAll(state.errors());
        if (diagnostics.hasErrors()) {
            List<SemanticError> sorted = diagnostics.sorted();
            CompilerLogger.moduleFailed(module.name(), sorted);
            throw new CompilationException(diagnostics.summary(), sorted);
        }

        Module resolved = state.module();
        StructLayoutTable layouts = StructLayoutTable.build(resolved);
        TargetAbi target = TargetAbi.fromHint(config.targetAbi());
        AbiStrategy abi = abiRegistry.strategyFor(target, layouts, config.strictStructLayout());
        CompilerLogger.moduleCompiled(module.name(), layouts.all().size(), target.name());
        return new CompiledModule(resolved, layouts, abi);
    }

    @Override
    public List<ModuleOutcome> compileAll(List<Module> modules) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.parallelism(), Math.max(1, modules.size())));
        try {
            List<Future<ModuleOutcome>> futures = new ArrayList<>(modules.size());
            for (Module module : modules) {
                futures.add(executor.submit(() -> compileOne(module)));
            }
            List<ModuleOutcome> outcomes = new ArrayList<>(futures.size());
            for (Future<ModuleOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while compiling modules", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Compilation of a module failed unexpectedly", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private ModuleOutcome compileOne(Module module) {
        try {
            return new ModuleOutcome(module.name(), compile(module), List.of());
        } catch (CompilationException e) {
            return new ModuleOutcome(module.name(), null, e.getDiagnostics());
        }
    }
}

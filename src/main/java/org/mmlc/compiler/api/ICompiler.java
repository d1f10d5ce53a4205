package org.mmlc.compiler.api;

import org.mmlc.compiler.frontend.ast.Module;

import java.util.List;

/**
 * Defines the public interface of the semantic pipeline and ABI lowering.
 */
public interface ICompiler {

    /**
     * Resolves a parsed module and prepares its code generation metadata.
     *
     * @param module The module as produced by the parser.
     * @return The resolved module with its struct layouts and the target's ABI strategy.
     * @throws CompilationException if any diagnostic was reported; no partial result is returned.
     */
    CompiledModule compile(Module module) throws CompilationException;

    /**
     * Compiles independent modules, possibly in parallel.
     *
     * @param modules The parsed modules.
     * @return One outcome per module, in input order.
     */
    List<ModuleOutcome> compileAll(List<Module> modules);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);
}

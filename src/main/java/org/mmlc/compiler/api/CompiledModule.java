package org.mmlc.compiler.api;

import org.mmlc.compiler.backend.abi.AbiStrategy;
import org.mmlc.compiler.backend.abi.StructLayoutTable;
import org.mmlc.compiler.frontend.ast.Module;

/**
 * Everything code generation needs for one module.
 *
 * @param module        The fully resolved, type-annotated module, free of member errors.
 * @param structLayouts The layouts of the module's aggregate types.
 * @param abi           The struct lowering strategy of the configured target.
 */
public record CompiledModule(Module module, StructLayoutTable structLayouts, AbiStrategy abi) {}

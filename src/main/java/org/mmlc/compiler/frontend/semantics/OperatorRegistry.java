package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.frontend.ast.FnParam;
import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.OpDef;
import org.mmlc.compiler.frontend.ast.OperatorDef;
import org.mmlc.compiler.frontend.ast.OperatorTable;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the operator table of a module from the built-in operators and the operators the
 * module declares, before any expression is rewritten.
 * <p>
 * An operator name and arity maps to exactly one fixity. A declaration that repeats a
 * known operator with the same fixity replaces it (its signature wins); one with a
 * different fixity is reported and ignored.
 */
public final class OperatorRegistry implements ISemanticPhase {

    private static final Logger LOG = LoggerFactory.getLogger(OperatorRegistry.class);

    private final List<OperatorDef> builtins;

    /**
     * @param builtins The built-in operators, usually from {@code CompilerConfig}.
     */
    public OperatorRegistry(List<OperatorDef> builtins) {
        this.builtins = List.copyOf(builtins);
    }

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        Module module = state.module();
        Map<String, OperatorDef> table = new LinkedHashMap<>();
        for (OperatorDef op : module.operators().all()) {
            table.put(key(op), op);
        }
        for (OperatorDef op : builtins) {
            table.putIfAbsent(key(op), op);
        }

        List<SemanticError> errors = new ArrayList<>();
        for (Member member : module.members()) {
            if (!(member instanceof OpDef opDef) || (opDef.arity() != 1 && opDef.arity() != 2)) {
                continue;
            }
            OperatorDef declared = toOperatorDef(opDef);
            OperatorDef existing = table.get(key(declared));
            if (existing != null && existing.span().equals(declared.span())) {
                continue;
            }
            if (existing != null && !existing.sameFixity(declared)) {
                errors.add(new SemanticError.DuplicateName(declared.name(), existing.span(), declared.span(),
                        "fixity " + declared.fixity() + " conflicts with " + existing.fixity(), name()));
                continue;
            }
            if (existing != null && existing.origin() == OperatorDef.Origin.DECLARED) {
                // a second declaration with equal fixity is a plain duplicate, reported by DuplicateNameChecker
                continue;
            }
            table.put(key(declared), declared);
        }

        LOG.debug("Module '{}' has {} operators in scope", module.name(), table.size());
        return state.withModule(module.withOperators(OperatorTable.of(table.values()))).addErrors(errors);
    }

    private static String key(OperatorDef op) {
        return op.name() + "/" + op.arity();
    }

    /**
     * Derives the table entry of a declared operator. Unannotated parameters and return
     * types become type variables that are instantiated freshly at each use.
     * @param opDef The declaration.
     * @return The operator definition.
     */
    static OperatorDef toOperatorDef(OpDef opDef) {
        List<TypeSpec> params = new ArrayList<>();
        List<FnParam> fnParams = opDef.params();
        for (int i = 0; i < fnParams.size(); i++) {
            FnParam p = fnParams.get(i);
            params.add(p.typeAsc() != null ? p.typeAsc() : new TypeSpec.TypeVariable("'" + opDef.name() + i));
        }
        TypeSpec result = opDef.returnType() != null
                ? opDef.returnType()
                : new TypeSpec.TypeVariable("'" + opDef.name() + "R");
        return new OperatorDef(opDef.name(), opDef.precedence(), opDef.associativity(), opDef.arity(),
                new TypeSpec.TypeFn(params, result), OperatorDef.Origin.DECLARED, opDef.span());
    }
}

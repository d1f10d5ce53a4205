package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.frontend.ast.Block;
import org.mmlc.compiler.frontend.ast.Bnd;
import org.mmlc.compiler.frontend.ast.Expr;
import org.mmlc.compiler.frontend.ast.FnDef;
import org.mmlc.compiler.frontend.ast.FnParam;
import org.mmlc.compiler.frontend.ast.Lambda;
import org.mmlc.compiler.frontend.ast.LocalBinding;
import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.OpDef;
import org.mmlc.compiler.frontend.ast.OperatorDef;
import org.mmlc.compiler.frontend.ast.OperatorTable;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.ResolvedTarget;
import org.mmlc.compiler.frontend.ast.Term;
import org.mmlc.compiler.frontend.TreeWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binds every {@link Ref} to the declaration it names.
 * <p>
 * Lookup goes from the innermost scope outwards: lambda parameters, block bindings
 * (sequential, each sees the previous ones), function or operator parameters, module
 * values and finally the module's operators. Names that cannot be found are reported and
 * resolution continues with the rest of the module. Already bound references are kept.
 */
public final class RefResolver implements ISemanticPhase {

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        Module module = state.module();
        List<SemanticError> errors = new ArrayList<>();
        SymbolTable symbols = new SymbolTable(errors, name());
        for (Member member : module.members()) {
            if (member instanceof FnDef fn) {
                symbols.defineGlobal(new Symbol(fn.name(), ResolvedTarget.Kind.FUNCTION, fn.span(), fn.params().size()));
            } else if (member instanceof Bnd bnd) {
                symbols.defineGlobal(new Symbol(bnd.name(), ResolvedTarget.Kind.BINDING, bnd.span(), 0));
            }
        }

        Resolution resolution = new Resolution(symbols, module.operators(), errors);
        List<Member> members = new ArrayList<>(module.members().size());
        for (Member member : module.members()) {
            members.add(resolution.resolveMember(member));
        }
        return state.withModule(module.withMembers(members)).addErrors(errors);
    }

    private final class Resolution {
        private final SymbolTable symbols;
        private final OperatorTable operators;
        private final List<SemanticError> errors;

        Resolution(SymbolTable symbols, OperatorTable operators, List<SemanticError> errors) {
            this.symbols = symbols;
            this.operators = operators;
            this.errors = errors;
        }

        Member resolveMember(Member member) {
            if (member instanceof FnDef fn) {
                return fn.withBody(resolveWithParams(fn.params(), fn.body()));
            }
            if (member instanceof OpDef op) {
                return op.withBody(resolveWithParams(op.params(), op.body()));
            }
            return TreeWalker.mapBody(member, body -> (Expr) resolve(body));
        }

        private Expr resolveWithParams(List<FnParam> params, Expr body) {
            symbols.enterScope();
            try {
                defineParams(params);
                return (Expr) resolve(body);
            } finally {
                symbols.leaveScope();
            }
        }

        private void defineParams(List<FnParam> params) {
            for (FnParam param : params) {
                symbols.define(new Symbol(param.name(), ResolvedTarget.Kind.PARAMETER, param.span(), 0));
            }
        }

        Term resolve(Term term) {
            if (term instanceof Ref ref) {
                return resolveRef(ref);
            }
            if (term instanceof Lambda lambda) {
                symbols.enterScope();
                try {
                    defineParams(lambda.params());
                    return lambda.withChildren(List.of(resolve(lambda.body())));
                } finally {
                    symbols.leaveScope();
                }
            }
            if (term instanceof Block block) {
                return resolveBlock(block);
            }
            List<Term> children = term.children();
            if (children.isEmpty()) {
                return term;
            }
            List<Term> resolved = new ArrayList<>(children.size());
            for (Term child : children) {
                resolved.add(resolve(child));
            }
            return term.withChildren(resolved);
        }

        private Term resolveBlock(Block block) {
            symbols.enterScope();
            try {
                List<LocalBinding> bindings = new ArrayList<>(block.bindings().size());
                for (LocalBinding binding : block.bindings()) {
                    Term value = resolve(binding.value());
                    symbols.define(new Symbol(binding.name(), ResolvedTarget.Kind.LOCAL, binding.span(), 0));
                    bindings.add(binding.withValue(value));
                }
                Term result = resolve(block.result());
                return new Block(block.span(), bindings, result, block.typeSpec());
            } finally {
                symbols.leaveScope();
            }
        }

        private Term resolveRef(Ref ref) {
            if (ref.resolvedTarget() != null) {
                return ref;
            }
            Optional<Symbol> symbol = symbols.resolve(ref.name());
            if (symbol.isPresent()) {
                return ref.withTarget(symbol.get().toTarget());
            }
            Optional<OperatorDef> op = operators.binary(ref.name()).or(() -> operators.prefix(ref.name()));
            if (op.isPresent()) {
                return ref.withTarget(new ResolvedTarget(ResolvedTarget.Kind.OPERATOR, ref.name(),
                        op.get().span(), ResolvedTarget.UNSPECIALIZED_ARITY));
            }
            errors.add(new SemanticError.UnresolvedRef(ref, name()));
            return ref;
        }
    }
}

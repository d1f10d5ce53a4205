package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.diagnostics.SemanticError;
import org.mmlc.compiler.diagnostics.TypeError;
import org.mmlc.compiler.frontend.TreeWalker;
import org.mmlc.compiler.frontend.ast.App;
import org.mmlc.compiler.frontend.ast.Block;
import org.mmlc.compiler.frontend.ast.Bnd;
import org.mmlc.compiler.frontend.ast.Cond;
import org.mmlc.compiler.frontend.ast.Decl;
import org.mmlc.compiler.frontend.ast.Expr;
import org.mmlc.compiler.frontend.ast.FnDef;
import org.mmlc.compiler.frontend.ast.FnParam;
import org.mmlc.compiler.frontend.ast.Hole;
import org.mmlc.compiler.frontend.ast.Lambda;
import org.mmlc.compiler.frontend.ast.Literal;
import org.mmlc.compiler.frontend.ast.LocalBinding;
import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.OpDef;
import org.mmlc.compiler.frontend.ast.OperatorDef;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.ResolvedTarget;
import org.mmlc.compiler.frontend.ast.Term;
import org.mmlc.compiler.frontend.ast.TypeDef;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;
import org.mmlc.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Assigns a type, or a type variable, to every term of the module.
 * <p>
 * Declared annotations are authoritative. Everything else follows from literal types,
 * operator signatures and the signatures of other declarations, which are typed on demand
 * (a declaration referenced while it is being typed is seen through its partial
 * signature). Each member is unified on its own; signatures taken from other members and
 * from the operator table get fresh type variables at every use.
 * <p>
 * Annotations naming a type the module does not define are reported as well.
 * Errors are collected for the whole module. References left unresolved by
 * {@link RefResolver} get a fresh variable so they do not cause follow-up errors.
 */
public final class TypeResolver implements ISemanticPhase {

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        Module module = state.module();
        ModuleTyping typing = new ModuleTyping(module);
        List<Member> members = new ArrayList<>(module.members().size());
        List<SemanticError> errors = new ArrayList<>(undefinedTypes(module));
        for (Member member : module.members()) {
            MemberResult result = typing.member(member);
            members.add(result.member());
            errors.addAll(result.errors());
        }
        return state.withModule(module.withMembers(members)).addErrors(errors);
    }

    /**
     * Checks every annotation and type definition against the names of the module's
     * {@link TypeDef}s, basic types included.
     */
    private List<SemanticError> undefinedTypes(Module module) {
        Set<String> known = new HashSet<>();
        for (Member member : module.members()) {
            if (member instanceof TypeDef def) {
                known.add(def.name());
            }
        }
        List<SemanticError> errors = new ArrayList<>();
        BiConsumer<SourceSpan, TypeSpec> check = (span, type) -> collectUndefined(span, type, known, errors);
        Map<Class<? extends Term>, Consumer<Term>> handlers = Map.of(
                Block.class, t -> ((Block) t).bindings().forEach(b -> check.accept(b.span(), b.typeAsc())),
                Lambda.class, t -> ((Lambda) t).params().forEach(p -> check.accept(p.span(), p.typeAsc())));
        TreeWalker locals = new TreeWalker(handlers);
        for (Member member : module.members()) {
            if (member instanceof TypeDef def) {
                check.accept(def.span(), def.definition());
            } else if (member instanceof Bnd bnd) {
                check.accept(bnd.span(), bnd.typeAsc());
            } else if (member instanceof FnDef fn) {
                fn.params().forEach(p -> check.accept(p.span(), p.typeAsc()));
                check.accept(fn.span(), fn.returnType());
            } else if (member instanceof OpDef op) {
                op.params().forEach(p -> check.accept(p.span(), p.typeAsc()));
                check.accept(op.span(), op.returnType());
            }
            Expr body = TreeWalker.bodyOf(member);
            if (body != null) {
                locals.walk(body);
            }
        }
        return errors;
    }

    private void collectUndefined(SourceSpan span, TypeSpec type, Set<String> known, List<SemanticError> errors) {
        if (type instanceof TypeSpec.TypeRef ref) {
            if (!known.contains(ref.name())) {
                errors.add(new SemanticError.TypeCheckingError(new TypeError.UndefinedTypeRef(span, ref.name(), name())));
            }
        } else if (type instanceof TypeSpec.TypeFn fn) {
            fn.params().forEach(p -> collectUndefined(span, p, known, errors));
            collectUndefined(span, fn.result(), known, errors);
        } else if (type instanceof TypeSpec.NativeStruct struct) {
            struct.fields().forEach(f -> collectUndefined(span, f.type(), known, errors));
        }
    }

    private record MemberResult(Member member, TypeSpec type, List<SemanticError> errors) {}

    private final class ModuleTyping {
        private final Module module;
        private final Map<String, Decl> values = new HashMap<>();
        private final Map<Member, MemberResult> done = new IdentityHashMap<>();
        private final Map<Member, TypeSpec> inProgress = new IdentityHashMap<>();
        private int nextVariable;

        ModuleTyping(Module module) {
            this.module = module;
            for (Member member : module.members()) {
                if (member instanceof FnDef || member instanceof Bnd) {
                    values.putIfAbsent(((Decl) member).name(), (Decl) member);
                }
            }
        }

        TypeSpec fresh() {
            return new TypeSpec.TypeVariable("'T" + nextVariable++);
        }

        MemberResult member(Member member) {
            MemberResult cached = done.get(member);
            if (cached != null) {
                return cached;
            }
            MemberResult result;
            if (member instanceof Bnd bnd) {
                result = typeBinding(bnd);
            } else if (member instanceof FnDef fn) {
                result = typeFunction(fn, fn.params(), fn.body(), fn.returnType(), fn::withBody);
            } else if (member instanceof OpDef op) {
                result = typeFunction(op, op.params(), op.body(), op.returnType(), op::withBody);
            } else {
                result = new MemberResult(member, null, List.of());
            }
            done.put(member, result);
            return result;
        }

        private MemberResult typeBinding(Bnd bnd) {
            MemberTyping typing = new MemberTyping();
            TypeSpec declared = bnd.typeAsc() != null ? bnd.typeAsc() : fresh();
            inProgress.put(bnd, declared);
            try {
                Term value = typing.type(bnd.value(), bnd.typeAsc());
                typing.expect(value, declared);
                Expr finished = (Expr) typing.finish(value);
                return new MemberResult(bnd.withValue(finished), typing.unifier.zonk(declared), typing.errors);
            } finally {
                inProgress.remove(bnd);
            }
        }

        private MemberResult typeFunction(Member member, List<FnParam> params, Expr body, TypeSpec returnType,
                                          Function<Expr, Member> rebuild) {
            MemberTyping typing = new MemberTyping();
            List<TypeSpec> paramTypes = typing.bindParams(params);
            TypeSpec result = returnType != null ? returnType : fresh();
            TypeSpec signature = new TypeSpec.TypeFn(paramTypes, result);
            inProgress.put(member, signature);
            try {
                Term typedBody = typing.type(body, result);
                typing.expect(typedBody, result);
                Expr finished = (Expr) typing.finish(typedBody);
                return new MemberResult(rebuild.apply(finished), typing.unifier.zonk(signature), typing.errors);
            } finally {
                inProgress.remove(member);
            }
        }

        TypeSpec valueType(String name) {
            Decl decl = values.get(name);
            if (decl == null) {
                return fresh();
            }
            TypeSpec partial = inProgress.get(decl);
            if (partial != null) {
                return partial;
            }
            TypeSpec type = member(decl).type();
            return type == null ? fresh() : instantiate(type);
        }

        TypeSpec operatorType(ResolvedTarget target) {
            Optional<OperatorDef> op = target.arity() == ResolvedTarget.UNSPECIALIZED_ARITY
                    ? module.operators().binary(target.name()).or(() -> module.operators().prefix(target.name()))
                    : module.operators().lookup(target.name(), target.arity());
            return op.map(o -> instantiate(o.signature())).orElseGet(this::fresh);
        }

        TypeSpec instantiate(TypeSpec type) {
            return rename(type, new HashMap<>());
        }

        private TypeSpec rename(TypeSpec type, Map<String, TypeSpec> renaming) {
            if (type instanceof TypeSpec.TypeVariable var) {
                return renaming.computeIfAbsent(var.name(), n -> fresh());
            }
            if (type instanceof TypeSpec.TypeFn fn) {
                List<TypeSpec> params = new ArrayList<>(fn.params().size());
                for (TypeSpec param : fn.params()) {
                    params.add(rename(param, renaming));
                }
                return new TypeSpec.TypeFn(params, rename(fn.result(), renaming));
            }
            return type;
        }

        /**
         * Typing state of a single member.
         */
        private final class MemberTyping {
            private final Unifier unifier = new Unifier();
            private final Map<SourceSpan, TypeSpec> locals = new HashMap<>();
            private final List<Hole> holes = new ArrayList<>();
            private final List<SemanticError> errors = new ArrayList<>();

            List<TypeSpec> bindParams(List<FnParam> params) {
                List<TypeSpec> types = new ArrayList<>(params.size());
                for (FnParam param : params) {
                    TypeSpec type = param.typeAsc() != null ? param.typeAsc() : fresh();
                    locals.put(param.span(), type);
                    types.add(type);
                }
                return types;
            }

            Term type(Term term, TypeSpec expected) {
                if (term instanceof Literal literal) {
                    return literal;
                }
                if (term instanceof Ref ref) {
                    return ref.withType(refType(ref));
                }
                if (term instanceof Hole hole) {
                    Hole typed = hole.withType(expected != null ? expected : fresh());
                    holes.add(typed);
                    return typed;
                }
                if (term instanceof Expr expr) {
                    return typeExpr(expr, expected);
                }
                if (term instanceof App app) {
                    return typeApp(app);
                }
                if (term instanceof Cond cond) {
                    return typeCond(cond, expected);
                }
                if (term instanceof Lambda lambda) {
                    List<TypeSpec> params = bindParams(lambda.params());
                    Term body = type(lambda.body(), null);
                    return lambda.withChildren(List.of(body)).withType(new TypeSpec.TypeFn(params, body.typeSpec()));
                }
                return typeBlock((Block) term, expected);
            }

            private TypeSpec refType(Ref ref) {
                ResolvedTarget target = ref.resolvedTarget();
                if (target == null) {
                    return fresh();
                }
                return switch (target.kind()) {
                    case PARAMETER, LOCAL -> locals.containsKey(target.declSpan()) ? locals.get(target.declSpan()) : fresh();
                    case BINDING, FUNCTION -> valueType(target.name());
                    case OPERATOR -> operatorType(target);
                };
            }

            private Term typeExpr(Expr expr, TypeSpec expected) {
                List<Term> typed = new ArrayList<>(expr.terms().size());
                for (int i = 0; i < expr.terms().size(); i++) {
                    boolean last = i == expr.terms().size() - 1;
                    typed.add(type(expr.terms().get(i), last ? expected : null));
                }
                TypeSpec type = typed.isEmpty() ? fresh() : typed.get(typed.size() - 1).typeSpec();
                return new Expr(expr.span(), typed, type);
            }

            private Term typeApp(App app) {
                Term fn = type(app.fn(), null);
                Term arg = type(app.arg(), null);
                TypeSpec fnType = unifier.resolve(fn.typeSpec());
                TypeSpec result;
                if (fnType instanceof TypeSpec.TypeFn signature) {
                    if (signature.params().isEmpty()) {
                        expect(arg, TypeSpec.UNIT);
                        result = signature.result();
                    } else {
                        expect(arg, signature.params().get(0));
                        List<TypeSpec> rest = signature.params().subList(1, signature.params().size());
                        result = rest.isEmpty() ? signature.result() : new TypeSpec.TypeFn(rest, signature.result());
                    }
                } else if (fnType instanceof TypeSpec.TypeVariable) {
                    result = fresh();
                    unifier.unify(fnType, new TypeSpec.TypeFn(List.of(arg.typeSpec()), result));
                } else {
                    errors.add(new SemanticError.TypeCheckingError(new TypeError.InvalidApplication(
                            fn.span(), Messages.applicationTarget(fn), unifier.zonk(fnType),
                            TypeError.InvalidApplication.Detail.NOT_A_FUNCTION, name())));
                    result = fresh();
                }
                return new App(app.span(), fn, arg, result);
            }

            private Term typeCond(Cond cond, TypeSpec expected) {
                Term condition = type(cond.cond(), TypeSpec.BOOL);
                expect(condition, TypeSpec.BOOL);
                Term ifTrue = type(cond.ifTrue(), expected);
                Term ifFalse = type(cond.ifFalse(), expected != null ? expected : ifTrue.typeSpec());
                if (!unifier.unify(ifTrue.typeSpec(), ifFalse.typeSpec())) {
                    errors.add(new SemanticError.TypeCheckingError(new TypeError.ConditionalBranchMismatch(
                            cond.span(), unifier.zonk(ifTrue.typeSpec()), unifier.zonk(ifFalse.typeSpec()), name())));
                }
                return new Cond(cond.span(), condition, ifTrue, ifFalse, ifTrue.typeSpec());
            }

            private Term typeBlock(Block block, TypeSpec expected) {
                List<LocalBinding> bindings = new ArrayList<>(block.bindings().size());
                for (LocalBinding binding : block.bindings()) {
                    Term value = type(binding.value(), binding.typeAsc());
                    TypeSpec declared = binding.typeAsc() != null ? binding.typeAsc() : value.typeSpec();
                    expect(value, declared);
                    locals.put(binding.span(), declared);
                    bindings.add(binding.withValue(value));
                }
                Term result = type(block.result(), expected);
                return new Block(block.span(), bindings, result, result.typeSpec());
            }

            /**
             * Unifies a term's type with the required one, reporting a mismatch.
             */
            void expect(Term term, TypeSpec required) {
                if (!unifier.unify(required, term.typeSpec())) {
                    errors.add(new SemanticError.TypeCheckingError(new TypeError.TypeMismatch(
                            term.span(), unifier.zonk(required), unifier.zonk(term.typeSpec()), name())));
                }
            }

            /**
             * Applies the final substitution to every node and reports holes whose type
             * nothing determined.
             */
            Term finish(Term term) {
                for (Hole hole : holes) {
                    if (unifier.zonk(hole.typeSpec()) instanceof TypeSpec.TypeVariable) {
                        errors.add(new SemanticError.TypeCheckingError(
                                new TypeError.UnresolvableType(hole.span(), null, name())));
                    }
                }
                return TreeWalker.transform(term,
                        t -> t.typeSpec() == null ? t : t.withType(unifier.zonk(t.typeSpec())));
            }
        }
    }
}

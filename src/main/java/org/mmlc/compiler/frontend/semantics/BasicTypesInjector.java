package org.mmlc.compiler.frontend.semantics;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.TypeDef;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Prepends the native definitions of the built-in types to a module. A type the module
 * declares itself is not injected.
 */
public final class BasicTypesInjector implements ISemanticPhase {

    static final List<TypeDef> BASIC_TYPES = List.of(
            basic("Int", new TypeSpec.NativePrimitive("i64")),
            basic("Float", new TypeSpec.NativePrimitive("double")),
            basic("Bool", new TypeSpec.NativePrimitive("i1")),
            basic("Unit", new TypeSpec.NativePrimitive("void")),
            basic("CharPtr", new TypeSpec.NativePointer("i8")),
            basic("String", new TypeSpec.NativeStruct(List.of(
                    new TypeSpec.StructField("length", TypeSpec.INT),
                    new TypeSpec.StructField("data", new TypeSpec.TypeRef("CharPtr"))))));

    private static TypeDef basic(String name, TypeSpec definition) {
        return new TypeDef(SourceSpan.SYNTHETIC, name, definition);
    }

    @Override
    public SemanticPhaseState apply(SemanticPhaseState state) {
        Module module = state.module();
        List<Member> members = new ArrayList<>();
        for (TypeDef basic : BASIC_TYPES) {
            boolean declared = module.members().stream()
                    .anyMatch(m -> m instanceof TypeDef t && t.name().equals(basic.name()));
            if (!declared) {
                members.add(basic);
            }
        }
        members.addAll(module.members());
        return state.withModule(module.withMembers(members));
    }
}

package org.mmlc.compiler.frontend.ast.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A type expression, either written by the user as an annotation or computed by the
 * type resolver. Native variants describe how a named type is represented in the
 * target IR and are what the struct layout table is built from.
 */
public sealed interface TypeSpec permits TypeSpec.TypeRef, TypeSpec.TypeFn, TypeSpec.TypeVariable,
        TypeSpec.NativePrimitive, TypeSpec.NativePointer, TypeSpec.NativeStruct {

    /** The built-in integer type. */
    TypeRef INT = new TypeRef("Int");
    /** The built-in floating point type. */
    TypeRef FLOAT = new TypeRef("Float");
    /** The built-in boolean type. */
    TypeRef BOOL = new TypeRef("Bool");
    /** The built-in string type. */
    TypeRef STRING = new TypeRef("String");
    /** The built-in unit type. */
    TypeRef UNIT = new TypeRef("Unit");

    /**
     * @return A compact, user-facing rendering of this type.
     */
    String render();

    /**
     * A reference to a named type.
     * @param name The type name.
     */
    record TypeRef(String name) implements TypeSpec {
        @Override
        public String render() {
            return name;
        }
    }

    /**
     * A curried function type. An empty parameter list denotes a function that is
     * called with the unit value.
     * @param params The parameter types, outermost first.
     * @param result The result type.
     */
    record TypeFn(List<TypeSpec> params, TypeSpec result) implements TypeSpec {
        public TypeFn {
            params = List.copyOf(params);
        }

        @Override
        public String render() {
            if (params.isEmpty()) {
                return "() -> " + result.render();
            }
            return params.stream().map(TypeSpec::render).collect(Collectors.joining(" -> "))
                    + " -> " + result.render();
        }
    }

    /**
     * An unknown type awaiting unification.
     * @param name The variable name, e.g. {@code 'T3}.
     */
    record TypeVariable(String name) implements TypeSpec {
        @Override
        public String render() {
            return name;
        }
    }

    /**
     * A scalar represented directly by an IR type.
     * @param llvmType The IR type, e.g. {@code i64}.
     */
    record NativePrimitive(String llvmType) implements TypeSpec {
        @Override
        public String render() {
            return "@native[t=" + llvmType + "]";
        }
    }

    /**
     * A pointer to a native value.
     * @param llvmType The pointee IR type.
     */
    record NativePointer(String llvmType) implements TypeSpec {
        @Override
        public String render() {
            return "@native[t=*" + llvmType + "]";
        }
    }

    /**
     * An aggregate with ordered, named fields.
     * @param fields The fields in declaration order.
     */
    record NativeStruct(List<StructField> fields) implements TypeSpec {
        public NativeStruct {
            fields = List.copyOf(fields);
        }

        @Override
        public String render() {
            return fields.stream()
                    .map(f -> f.name() + ": " + f.type().render())
                    .collect(Collectors.joining(", ", "@native{", "}"));
        }
    }

    /**
     * A single field of a {@link NativeStruct}.
     * @param name The field name.
     * @param type The field type.
     */
    record StructField(String name, TypeSpec type) {}
}

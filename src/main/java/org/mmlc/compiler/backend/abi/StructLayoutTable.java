package org.mmlc.compiler.backend.abi;

import org.mmlc.compiler.frontend.ast.Member;
import org.mmlc.compiler.frontend.ast.Module;
import org.mmlc.compiler.frontend.ast.TypeDef;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Field layouts of the aggregate types declared in a module, keyed by IR struct name.
 * Built once per module and read-only afterwards.
 */
public final class StructLayoutTable {

    private final Map<String, StructLayout> layouts;

    private StructLayoutTable(Map<String, StructLayout> layouts) {
        this.layouts = Collections.unmodifiableMap(new LinkedHashMap<>(layouts));
    }

    /**
     * @param layouts The layouts to hold.
     * @return A table of the given layouts.
     */
    public static StructLayoutTable of(List<StructLayout> layouts) {
        Map<String, StructLayout> map = new LinkedHashMap<>();
        layouts.forEach(l -> map.put(l.typeName(), l));
        return new StructLayoutTable(map);
    }

    /**
     * Computes the layout of every type definition with a native struct body.
     * @param module A module whose type definitions are final.
     * @return The table.
     */
    public static StructLayoutTable build(Module module) {
        Map<String, TypeDef> typeDefs = new HashMap<>();
        for (Member member : module.members()) {
            if (member instanceof TypeDef typeDef) {
                typeDefs.putIfAbsent(typeDef.name(), typeDef);
            }
        }
        Builder builder = new Builder(typeDefs);
        for (TypeDef typeDef : typeDefs.values()) {
            if (typeDef.definition() instanceof TypeSpec.NativeStruct) {
                builder.layoutOf(typeDef.name());
            }
        }
        return new StructLayoutTable(sortedByName(builder.layouts));
    }

    private static Map<String, StructLayout> sortedByName(Map<String, StructLayout> layouts) {
        Map<String, StructLayout> sorted = new LinkedHashMap<>();
        layouts.keySet().stream().sorted().forEach(k -> sorted.put(k, layouts.get(k)));
        return sorted;
    }

    /**
     * @param llvmType An IR type.
     * @return The layout, if the type is a known aggregate.
     */
    public Optional<StructLayout> lookup(String llvmType) {
        return Optional.ofNullable(layouts.get(llvmType));
    }

    /**
     * @param llvmType An IR type.
     * @return The ordered field types, empty if unknown.
     */
    public List<String> fieldTypes(String llvmType) {
        return lookup(llvmType).map(StructLayout::fieldTypes).orElse(List.of());
    }

    /**
     * @param llvmType An IR type.
     * @return Size in bytes of a known aggregate or a scalar.
     */
    public int sizeOf(String llvmType) {
        return lookup(llvmType).map(StructLayout::size).orElseGet(() -> NativeTypes.sizeOf(llvmType));
    }

    /**
     * @return All layouts ordered by type name.
     */
    public List<StructLayout> all() {
        return List.copyOf(layouts.values());
    }

    /**
     * Resolves type definitions to IR types, computing nested struct layouts first.
     */
    private static final class Builder {
        private final Map<String, TypeDef> typeDefs;
        private final Map<String, StructLayout> layouts = new HashMap<>();
        private final Set<String> inProgress = new HashSet<>();

        Builder(Map<String, TypeDef> typeDefs) {
            this.typeDefs = typeDefs;
        }

        StructLayout layoutOf(String name) {
            String llvmName = NativeTypes.structTypeName(name);
            StructLayout existing = layouts.get(llvmName);
            if (existing != null) {
                return existing;
            }
            TypeSpec.NativeStruct struct = (TypeSpec.NativeStruct) typeDefs.get(name).definition();
            inProgress.add(name);
            List<String> fieldTypes = new ArrayList<>();
            int offset = 0;
            int alignment = 1;
            for (TypeSpec.StructField field : struct.fields()) {
                String fieldType = llvmTypeOf(field.type(), new HashSet<>());
                int fieldSize;
                int fieldAlign;
                if (NativeTypes.isStruct(fieldType)) {
                    StructLayout nested = layouts.get(fieldType);
                    fieldSize = nested.size();
                    fieldAlign = nested.alignment();
                } else {
                    fieldSize = NativeTypes.sizeOf(fieldType);
                    fieldAlign = NativeTypes.alignOf(fieldType);
                }
                offset = NativeTypes.alignTo(offset, fieldAlign) + fieldSize;
                alignment = Math.max(alignment, fieldAlign);
                fieldTypes.add(fieldType);
            }
            inProgress.remove(name);
            StructLayout layout = new StructLayout(llvmName, fieldTypes, NativeTypes.alignTo(offset, alignment), alignment);
            layouts.put(llvmName, layout);
            return layout;
        }

        /**
         * Field types that cannot be represented directly, such as functions, type variables
         * a struct that contains itself or an alias that refers back to itself, are stored
         * as pointers.
         */
        private String llvmTypeOf(TypeSpec type, Set<String> aliases) {
            if (type instanceof TypeSpec.NativePrimitive primitive) {
                return primitive.llvmType();
            }
            if (type instanceof TypeSpec.TypeRef ref) {
                TypeDef target = typeDefs.get(ref.name());
                if (target == null) {
                    return "ptr";
                }
                if (target.definition() instanceof TypeSpec.NativeStruct) {
                    if (inProgress.contains(ref.name())) {
                        return "ptr";
                    }
                    return layoutOf(ref.name()).typeName();
                }
                if (!aliases.add(ref.name())) {
                    return "ptr";
                }
                return llvmTypeOf(target.definition(), aliases);
            }
            return "ptr";
        }
    }
}

package org.mmlc.compiler.backend.abi;

import java.util.List;

/**
 * Physical layout of one aggregate type.
 *
 * @param typeName   The IR name, e.g. {@code %struct.String}.
 * @param fieldTypes The IR types of the fields in declaration order.
 * @param size       Size in bytes including padding.
 * @param alignment  Alignment in bytes, the largest field alignment.
 */
public record StructLayout(String typeName, List<String> fieldTypes, int size, int alignment) {

    public StructLayout {
        fieldTypes = List.copyOf(fieldTypes);
    }

    /**
     * @return The number of fields.
     */
    public int fieldCount() {
        return fieldTypes.size();
    }

    /**
     * @return {@code true} if every field is a scalar or a pointer.
     */
    public boolean hasOnlyScalarFields() {
        return fieldTypes.stream().noneMatch(NativeTypes::isStruct);
    }
}

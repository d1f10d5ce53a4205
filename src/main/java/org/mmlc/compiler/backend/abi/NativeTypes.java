package org.mmlc.compiler.backend.abi;

/**
 * Size and alignment of scalar IR types on 64-bit targets.
 */
public final class NativeTypes {

    /** Prefix of named aggregate types. */
    public static final String STRUCT_PREFIX = "%struct.";

    private NativeTypes() {}

    /**
     * @param llvmType A scalar IR type.
     * @return Its size in bytes; pointers and unknown types count as 8.
     */
    public static int sizeOf(String llvmType) {
        return switch (llvmType) {
            case "i1", "i8" -> 1;
            case "i16" -> 2;
            case "i32", "float" -> 4;
            default -> 8;
        };
    }

    /**
     * Scalars are naturally aligned.
     * @param llvmType A scalar IR type.
     * @return Its alignment in bytes.
     */
    public static int alignOf(String llvmType) {
        return sizeOf(llvmType);
    }

    /**
     * @param llvmType An IR type.
     * @return {@code true} for pointer types.
     */
    public static boolean isPointer(String llvmType) {
        return llvmType.equals("ptr") || llvmType.endsWith("*");
    }

    /**
     * @param llvmType An IR type.
     * @return {@code true} for named aggregates.
     */
    public static boolean isStruct(String llvmType) {
        return llvmType.startsWith(STRUCT_PREFIX);
    }

    /**
     * @param typeName A source-level type name.
     * @return The IR name of the aggregate.
     */
    public static String structTypeName(String typeName) {
        return STRUCT_PREFIX + typeName;
    }

    /**
     * Rounds an offset up to the next multiple of an alignment.
     * @param offset The offset.
     * @param alignment A positive alignment.
     * @return The aligned offset.
     */
    public static int alignTo(int offset, int alignment) {
        return (offset + alignment - 1) / alignment * alignment;
    }
}

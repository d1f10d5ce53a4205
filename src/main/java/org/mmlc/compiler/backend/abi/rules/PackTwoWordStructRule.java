package org.mmlc.compiler.backend.abi.rules;

import org.mmlc.compiler.backend.abi.ArgLowering;
import org.mmlc.compiler.backend.abi.IStructLoweringRule;
import org.mmlc.compiler.backend.abi.LoweringState;
import org.mmlc.compiler.backend.abi.NativeArg;
import org.mmlc.compiler.backend.abi.NativeTypes;
import org.mmlc.compiler.backend.abi.StructLayout;

import java.util.List;

/**
 * AArch64 register pack: a struct of exactly two 64-bit integer or pointer fields is
 * passed as {@code [2 x i64]}, pointers converted with {@code ptrtoint}.
 */
public final class PackTwoWordStructRule implements IStructLoweringRule {

    static final String PACKED_TYPE = "[2 x i64]";

    @Override
    public String name() {
        return "pack-two-word-struct";
    }

    @Override
    public boolean isApplicable(StructLayout layout) {
        return layout.fieldCount() == 2
                && layout.fieldTypes().stream().allMatch(t -> t.equals("i64") || NativeTypes.isPointer(t));
    }

    @Override
    public List<String> lowerParamTypes(StructLayout layout) {
        return List.of(PACKED_TYPE);
    }

    @Override
    public ArgLowering lowerArg(NativeArg arg, StructLayout layout, LoweringState state) {
        LoweringState current = state;
        String aggregate = "undef";
        for (int i = 0; i < 2; i++) {
            String fieldType = layout.fieldTypes().get(i);
            String field = current.nextValue();
            current = current.assign("extractvalue " + layout.typeName() + " " + arg.value() + ", " + i);
            String word = field;
            if (NativeTypes.isPointer(fieldType)) {
                word = current.nextValue();
                current = current.assign("ptrtoint ptr " + field + " to i64");
            }
            String packed = current.nextValue();
            current = current.assign("insertvalue " + PACKED_TYPE + " " + aggregate + ", i64 " + word + ", " + i);
            aggregate = packed;
        }
        return new ArgLowering(List.of(new NativeArg(aggregate, PACKED_TYPE)), current);
    }

    @Override
    public boolean returnsIndirectly() {
        return false;
    }
}

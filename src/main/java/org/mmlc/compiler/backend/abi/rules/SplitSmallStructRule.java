package org.mmlc.compiler.backend.abi.rules;

import org.mmlc.compiler.backend.abi.ArgLowering;
import org.mmlc.compiler.backend.abi.IStructLoweringRule;
import org.mmlc.compiler.backend.abi.LoweringState;
import org.mmlc.compiler.backend.abi.NativeArg;
import org.mmlc.compiler.backend.abi.StructLayout;

import java.util.ArrayList;
import java.util.List;

/**
 * x86-64 register pack: a struct of at most two scalar fields that fits in two
 * eightbytes is passed as its fields, each extracted from the struct value.
 */
public final class SplitSmallStructRule implements IStructLoweringRule {

    /** Two eightbytes. */
    static final int MAX_REGISTER_BYTES = 16;
    static final int MAX_FIELDS = 2;

    /**
     * @param layout A layout.
     * @return {@code true} if the struct fits in two general purpose registers.
     */
    public static boolean fitsInRegisters(StructLayout layout) {
        return layout.fieldCount() <= MAX_FIELDS
                && layout.size() <= MAX_REGISTER_BYTES
                && layout.hasOnlyScalarFields();
    }

    @Override
    public String name() {
        return "split-small-struct";
    }

    @Override
    public boolean isApplicable(StructLayout layout) {
        return fitsInRegisters(layout);
    }

    @Override
    public List<String> lowerParamTypes(StructLayout layout) {
        return layout.fieldTypes();
    }

    @Override
    public ArgLowering lowerArg(NativeArg arg, StructLayout layout, LoweringState state) {
        List<NativeArg> fields = new ArrayList<>(layout.fieldCount());
        LoweringState current = state;
        for (int i = 0; i < layout.fieldCount(); i++) {
            String field = current.nextValue();
            current = current.assign("extractvalue " + layout.typeName() + " " + arg.value() + ", " + i);
            fields.add(new NativeArg(field, layout.fieldTypes().get(i)));
        }
        return new ArgLowering(fields, current);
    }

    @Override
    public boolean returnsIndirectly() {
        return false;
    }
}

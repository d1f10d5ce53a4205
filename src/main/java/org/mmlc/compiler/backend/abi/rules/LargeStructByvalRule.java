package org.mmlc.compiler.backend.abi.rules;

import org.mmlc.compiler.backend.abi.StructLayout;

/**
 * x86-64 memory class: a struct that does not fit in registers is passed as a
 * {@code byval} pointer and returned through an sret pointer.
 */
public final class LargeStructByvalRule extends SpillingStructRule {

    @Override
    public String name() {
        return "large-struct-byval";
    }

    @Override
    public boolean isApplicable(StructLayout layout) {
        return !SplitSmallStructRule.fitsInRegisters(layout);
    }

    @Override
    protected String pointerType(StructLayout layout) {
        return "ptr byval(" + layout.typeName() + ") align 8";
    }
}

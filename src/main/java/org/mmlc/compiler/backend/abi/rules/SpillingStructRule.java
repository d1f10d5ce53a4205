package org.mmlc.compiler.backend.abi.rules;

import org.mmlc.compiler.backend.abi.ArgLowering;
import org.mmlc.compiler.backend.abi.IStructLoweringRule;
import org.mmlc.compiler.backend.abi.LoweringState;
import org.mmlc.compiler.backend.abi.NativeArg;
import org.mmlc.compiler.backend.abi.StructLayout;

import java.util.List;

/**
 * Base for rules that pass an aggregate through memory: the value is stored to a stack
 * slot and the slot's address is passed. Such aggregates are also returned indirectly.
 */
public abstract class SpillingStructRule implements IStructLoweringRule {

    /**
     * @param layout An applicable layout.
     * @return The pointer type used for the parameter.
     */
    protected abstract String pointerType(StructLayout layout);

    @Override
    public List<String> lowerParamTypes(StructLayout layout) {
        return List.of(pointerType(layout));
    }

    @Override
    public ArgLowering lowerArg(NativeArg arg, StructLayout layout, LoweringState state) {
        String slot = state.nextValue();
        LoweringState next = state
                .assign("alloca " + layout.typeName() + ", align " + layout.alignment())
                .emit("store " + layout.typeName() + " " + arg.value() + ", ptr " + slot);
        return new ArgLowering(List.of(new NativeArg(slot, pointerType(layout))), next);
    }

    @Override
    public boolean returnsIndirectly() {
        return true;
    }
}

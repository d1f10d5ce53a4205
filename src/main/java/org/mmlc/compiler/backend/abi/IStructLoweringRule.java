package org.mmlc.compiler.backend.abi;

import java.util.List;

/**
 * One calling-convention rule for passing aggregates. A strategy asks its rules in order
 * and the first applicable one decides.
 */
public interface IStructLoweringRule {

    /**
     * @return A short name for logs.
     */
    String name();

    /**
     * @param layout The aggregate's layout, never empty.
     * @return {@code true} if this rule decides how the aggregate is passed.
     */
    boolean isApplicable(StructLayout layout);

    /**
     * @param layout An applicable layout.
     * @return The parameter types replacing the aggregate parameter.
     */
    List<String> lowerParamTypes(StructLayout layout);

    /**
     * Produces the physical arguments for one aggregate argument.
     * @param arg The aggregate value.
     * @param layout Its applicable layout.
     * @param state The state before lowering.
     * @return The physical arguments and the new state.
     */
    ArgLowering lowerArg(NativeArg arg, StructLayout layout, LoweringState state);

    /**
     * @return {@code true} if an aggregate this rule applies to is returned through a hidden pointer.
     */
    boolean returnsIndirectly();
}

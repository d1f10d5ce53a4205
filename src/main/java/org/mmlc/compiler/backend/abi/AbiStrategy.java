package org.mmlc.compiler.backend.abi;

import java.util.List;

/**
 * Decides the physical parameter and return shape of calls involving aggregates for one
 * target architecture. Types that are not aggregates, or aggregates without a known
 * layout, pass through unchanged.
 */
public interface AbiStrategy {

    /**
     * @return The target this strategy implements.
     */
    TargetAbi target();

    /**
     * @param paramTypes Declared IR parameter types.
     * @return The physical parameter types.
     */
    List<String> lowerParamTypes(List<String> paramTypes);

    /**
     * @param args  Logical arguments.
     * @param state The state before lowering.
     * @return The physical arguments and the state after any materialized temporaries.
     */
    ArgLowering lowerArgs(List<NativeArg> args, LoweringState state);

    /**
     * @param returnType A declared IR return type.
     * @return {@code true} if the value must be returned through a hidden output pointer.
     */
    boolean needsSret(String returnType);

    /**
     * @param returnType A declared IR return type.
     * @return The physical return type and, when indirect, the hidden parameter.
     */
    ReturnLowering lowerReturnType(String returnType);

    /**
     * @param paramTypes Declared IR parameter types.
     * @param returnType Declared IR return type.
     * @return The physical signature, with the sret parameter first when needed.
     */
    LoweredSignature lowerSignature(List<String> paramTypes, String returnType);

    /**
     * Prepares the arguments of a call: allocates the result slot when the return is
     * indirect and lowers the remaining arguments.
     * @param returnType Declared IR return type of the callee.
     * @param args Logical arguments.
     * @param state The state before lowering.
     * @return The physical arguments, the result slot and the new state.
     */
    SretCall prepareCall(String returnType, List<NativeArg> args, LoweringState state);
}

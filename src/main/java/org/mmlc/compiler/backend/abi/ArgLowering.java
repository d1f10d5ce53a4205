package org.mmlc.compiler.backend.abi;

import java.util.List;

/**
 * Result of lowering call arguments.
 *
 * @param args  The physical arguments in call order.
 * @param state The state after the instructions needed to produce them.
 */
public record ArgLowering(List<NativeArg> args, LoweringState state) {

    public ArgLowering {
        args = List.copyOf(args);
    }
}

package org.mmlc.compiler.backend.abi;

import java.util.List;

/**
 * Arguments of a call whose result may be returned through a hidden pointer.
 *
 * @param args       The physical arguments, the result slot first when indirect.
 * @param resultSlot The register holding the result slot, or {@code null} for a direct return.
 * @param state      The state after materializing the slot and the arguments.
 */
public record SretCall(List<NativeArg> args, String resultSlot, LoweringState state) {

    public SretCall {
        args = List.copyOf(args);
    }

    /**
     * @return {@code true} if the caller must load the result from {@link #resultSlot()}.
     */
    public boolean isIndirect() {
        return resultSlot != null;
    }
}

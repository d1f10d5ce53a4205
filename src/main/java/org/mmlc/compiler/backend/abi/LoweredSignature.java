package org.mmlc.compiler.backend.abi;

import java.util.List;

/**
 * A function signature after struct lowering, sret pointer included.
 *
 * @param returnType The IR return type.
 * @param paramTypes The IR parameter types.
 */
public record LoweredSignature(String returnType, List<String> paramTypes) {

    public LoweredSignature {
        paramTypes = List.copyOf(paramTypes);
    }
}

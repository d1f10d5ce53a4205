package org.mmlc.compiler.backend.abi;

/**
 * Physical return shape of a function.
 *
 * @param returnType The IR return type.
 * @param sretParam  The hidden output-pointer parameter to prepend, or {@code null}.
 */
public record ReturnLowering(String returnType, String sretParam) {

    /**
     * @return {@code true} if the value is returned through a hidden pointer.
     */
    public boolean isIndirect() {
        return sretParam != null;
    }
}

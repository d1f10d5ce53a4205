package org.mmlc.compiler.backend.abi;

import java.util.Locale;

/**
 * The calling-convention families struct lowering knows about.
 */
public enum TargetAbi {
    /** System V x86-64: small structs are split into scalars, large ones passed byval. */
    X86_64,
    /** AArch64 AAPCS: two-word structs are packed, large ones passed through a pointer. */
    AARCH64,
    /** Unknown target: aggregates are passed unchanged. */
    DEFAULT;

    /**
     * Maps an architecture name or target triple to an ABI family. Only the first
     * component of a triple is considered.
     * @param hint e.g. {@code x86_64}, {@code arm64} or {@code aarch64-apple-darwin}; may be {@code null}.
     * @return The ABI family, {@link #DEFAULT} if the hint is unknown.
     */
    public static TargetAbi fromHint(String hint) {
        if (hint == null) {
            return DEFAULT;
        }
        String arch = hint.trim().toLowerCase(Locale.ROOT);
        if (arch.startsWith("x86-64")) {
            return X86_64;
        }
        int dash = arch.indexOf('-');
        if (dash > 0) {
            arch = arch.substring(0, dash);
        }
        return switch (arch) {
            case "x86_64", "amd64" -> X86_64;
            case "aarch64", "arm64" -> AARCH64;
            default -> DEFAULT;
        };
    }
}

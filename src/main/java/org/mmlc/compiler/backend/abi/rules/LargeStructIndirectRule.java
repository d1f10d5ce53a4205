package org.mmlc.compiler.backend.abi.rules;

import org.mmlc.compiler.backend.abi.StructLayout;

/**
 * AArch64 composite larger than 16 bytes: passed as a plain pointer to a caller-owned
 * copy and returned through an sret pointer.
 */
public final class LargeStructIndirectRule extends SpillingStructRule {

    static final int MAX_DIRECT_BYTES = 16;

    @Override
    public String name() {
        return "large-struct-indirect";
    }

    @Override
    public boolean isApplicable(StructLayout layout) {
        return layout.size() > MAX_DIRECT_BYTES;
    }

    @Override
    protected String pointerType(StructLayout layout) {
        return "ptr";
    }
}

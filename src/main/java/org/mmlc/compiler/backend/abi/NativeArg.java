package org.mmlc.compiler.backend.abi;

/**
 * A call argument as code generation sees it.
 *
 * @param value The operand, a register such as {@code %3} or a constant.
 * @param type  The IR type written before the operand.
 */
public record NativeArg(String value, String type) {}

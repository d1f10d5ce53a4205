package org.mmlc.compiler.backend.abi;

import java.util.ArrayList;
import java.util.List;

/**
 * Code generation state threaded through argument lowering: the next free virtual
 * register and the instructions materialized so far. Immutable; every operation returns
 * a new state.
 *
 * @param nextRegister The number of the next free register.
 * @param instructions The emitted instructions, without indentation.
 */
public record LoweringState(int nextRegister, List<String> instructions) {

    public LoweringState {
        instructions = List.copyOf(instructions);
    }

    /**
     * @param firstRegister The first free register of the function being emitted.
     * @return A state without instructions.
     */
    public static LoweringState startingAt(int firstRegister) {
        return new LoweringState(firstRegister, List.of());
    }

    /**
     * @return The name the next {@link #assign(String)} will define, e.g. {@code %7}.
     */
    public String nextValue() {
        return "%" + nextRegister;
    }

    /**
     * Emits {@code %N = instruction} and reserves the register.
     * @param instruction The right-hand side.
     * @return The new state.
     */
    public LoweringState assign(String instruction) {
        return new LoweringState(nextRegister + 1, append(nextValue() + " = " + instruction));
    }

    /**
     * Emits an instruction that defines no value.
     * @param instruction The instruction.
     * @return The new state.
     */
    public LoweringState emit(String instruction) {
        return new LoweringState(nextRegister, append(instruction));
    }

    private List<String> append(String line) {
        List<String> lines = new ArrayList<>(instructions.size() + 1);
        lines.addAll(instructions);
        lines.add(line);
        return lines;
    }
}

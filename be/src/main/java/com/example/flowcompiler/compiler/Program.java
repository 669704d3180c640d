package com.example.flowcompiler.compiler;

import java.util.List;

/**
 * Ordered, zero-indexed instruction sequence. Immutable; each compile produces a new one.
 */
public record Program(List<Instruction> instructions) {

    public static final Program EMPTY = new Program(List.of());

    public Program {
        instructions = instructions != null ? List.copyOf(instructions) : List.of();
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction get(int index) {
        return instructions.get(index);
    }
}

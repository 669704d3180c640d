package com.example.flowcompiler.compiler;

import com.example.flowcompiler.graph.ConfigMaps;

import java.util.Map;
import java.util.Objects;

/**
 * One element of a compiled program.
 * <p>
 * {@code actionType} is only set on actions. {@code branchTarget} is only set on conditions that
 * have an alternate path: the zero-based index execution jumps to when the condition is false.
 * When the condition holds, execution falls through to the next instruction.
 * </p>
 */
public record Instruction(InstructionKind kind, String actionType, Map<String, Object> config, Integer branchTarget) {

    public Instruction {
        Objects.requireNonNull(kind, "kind");
        config = ConfigMaps.copyOf(config);
        if (kind != InstructionKind.ACTION && actionType != null) {
            throw new IllegalArgumentException("actionType is only allowed on action instructions, got kind " + kind.wireName());
        }
        if (branchTarget != null) {
            if (kind != InstructionKind.CONDITION) {
                throw new IllegalArgumentException("branchTarget is only allowed on condition instructions, got kind " + kind.wireName());
            }
            if (branchTarget < 0) {
                throw new IllegalArgumentException("branchTarget must not be negative: " + branchTarget);
            }
        }
    }

    public static Instruction action(String actionType, Map<String, Object> config) {
        return new Instruction(InstructionKind.ACTION, actionType, config, null);
    }

    public static Instruction condition(Map<String, Object> config, Integer branchTarget) {
        return new Instruction(InstructionKind.CONDITION, null, config, branchTarget);
    }

    public static Instruction delay(Map<String, Object> config) {
        return new Instruction(InstructionKind.DELAY, null, config, null);
    }

    public boolean hasBranchTarget() {
        return branchTarget != null;
    }
}

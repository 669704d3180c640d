package com.example.flowcompiler.compiler;

import java.util.Objects;

/**
 * Result of one compile: the trigger descriptor and the program.
 */
public record CompiledWorkflow(TriggerDescriptor trigger, Program program) {

    public CompiledWorkflow {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(program, "program");
    }
}

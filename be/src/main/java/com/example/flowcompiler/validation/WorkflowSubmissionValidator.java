package com.example.flowcompiler.validation;

import com.example.flowcompiler.compiler.CompiledWorkflow;
import com.example.flowcompiler.compiler.Instruction;
import com.example.flowcompiler.compiler.Program;
import com.example.flowcompiler.compiler.TriggerDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks a compiled workflow before it is saved: trigger presence, trigger config, branch targets.
 * <p>
 * The compiler accepts any graph; these rules belong to the form that stores the result.
 * </p>
 */
public final class WorkflowSubmissionValidator {

    static final String EVENT_TRIGGER = "event";
    static final String SCHEDULE_TRIGGER = "schedule";
    static final String EVENT_TYPES = "event_types";
    static final String SCHEDULE_TYPE = "schedule_type";

    private WorkflowSubmissionValidator() {
    }

    /**
     * Validates the workflow. Throws {@link WorkflowValidationException} with all errors if invalid.
     */
    public static void validate(CompiledWorkflow workflow) {
        List<ValidationError> errors = new ArrayList<>();
        TriggerDescriptor trigger = workflow.trigger();

        if (!trigger.isPresent()) {
            errors.add(new ValidationError("trigger_type", "a trigger is required"));
        } else if (EVENT_TRIGGER.equals(trigger.triggerType())) {
            if (isEmpty(trigger.config().get(EVENT_TYPES))) {
                errors.add(new ValidationError("trigger_config." + EVENT_TYPES, "at least one event type is required"));
            }
        } else if (SCHEDULE_TRIGGER.equals(trigger.triggerType())) {
            if (isEmpty(trigger.config().get(SCHEDULE_TYPE))) {
                errors.add(new ValidationError("trigger_config." + SCHEDULE_TYPE, "schedule type is required"));
            }
        }

        Program program = workflow.program();
        for (int i = 0; i < program.size(); i++) {
            Instruction instruction = program.get(i);
            if (instruction.hasBranchTarget() && instruction.branchTarget() >= program.size()) {
                errors.add(new ValidationError("steps[" + i + "].else_goto_step",
                        "branch target " + instruction.branchTarget() + " is outside the program (size " + program.size() + ")"));
            }
        }

        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }
}

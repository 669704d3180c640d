package com.example.flowcompiler.mapping;

import com.example.flowcompiler.api.v1.dto.StepDto;
import com.example.flowcompiler.api.v1.dto.WorkflowRecordDto;
import com.example.flowcompiler.compiler.CompiledWorkflow;
import com.example.flowcompiler.compiler.Instruction;
import com.example.flowcompiler.compiler.InstructionKind;
import com.example.flowcompiler.compiler.Program;
import com.example.flowcompiler.compiler.TriggerDescriptor;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the stored workflow record to a compiled workflow and back.
 * <p>
 * Step types outside action, condition and delay (e.g. {@code loop}) are kept as opaque action
 * instructions whose action type is the step's action type or, if absent, the raw step type.
 * {@code else_goto_step} is only read on condition steps.
 * </p>
 */
@Component
@Slf4j
public class WorkflowRecordMapper {

    public CompiledWorkflow toCompiled(WorkflowRecordDto record) {
        if (record == null) {
            return new CompiledWorkflow(TriggerDescriptor.NONE, Program.EMPTY);
        }
        TriggerDescriptor trigger = new TriggerDescriptor(record.triggerType(), record.triggerConfig());
        List<Instruction> instructions = new ArrayList<>();
        List<StepDto> steps = record.steps() != null ? record.steps() : List.of();
        for (int i = 0; i < steps.size(); i++) {
            StepDto step = steps.get(i);
            if (step == null) {
                log.debug("Keeping null step at index {} as an empty action", i);
                instructions.add(Instruction.action(null, Map.of()));
                continue;
            }
            instructions.add(toInstruction(step, i));
        }
        return new CompiledWorkflow(trigger, new Program(instructions));
    }

    public WorkflowRecordDto toRecord(CompiledWorkflow compiled) {
        List<StepDto> steps = compiled.program().instructions().stream()
                .map(instruction -> new StepDto(
                        instruction.kind().wireName(),
                        instruction.actionType(),
                        instruction.config(),
                        instruction.branchTarget()
                ))
                .toList();
        TriggerDescriptor trigger = compiled.trigger();
        return new WorkflowRecordDto(trigger.triggerType(), trigger.config(), steps);
    }

    private Instruction toInstruction(StepDto step, int index) {
        Optional<InstructionKind> kind = InstructionKind.fromWireName(step.stepType());
        if (kind.isEmpty()) {
            String actionType = step.actionType() != null ? step.actionType() : step.stepType();
            log.debug("Mapping unknown step type '{}' at index {} to action '{}'", step.stepType(), index, actionType);
            return Instruction.action(actionType, step.config());
        }
        switch (kind.get()) {
            case CONDITION:
                Integer target = step.elseGotoStep();
                if (target != null && target < 0) {
                    log.debug("Ignoring negative else_goto_step {} at index {}", target, index);
                    target = null;
                }
                return Instruction.condition(step.config(), target);
            case DELAY:
                return Instruction.delay(step.config());
            default:
                return Instruction.action(step.actionType(), step.config());
        }
    }
}

package com.example.flowcompiler.api.v1;

import com.example.flowcompiler.api.v1.dto.GraphDto;
import com.example.flowcompiler.api.v1.dto.WorkflowRecordDto;
import com.example.flowcompiler.compiler.CompiledWorkflow;
import com.example.flowcompiler.compiler.WorkflowCompiler;
import com.example.flowcompiler.compiler.WorkflowDecompiler;
import com.example.flowcompiler.mapping.GraphDtoMapper;
import com.example.flowcompiler.mapping.WorkflowRecordMapper;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Stateless compile and decompile of whole workflows.
 * <p>
 * {@code POST /api/v1/programs/compile} turns a graph into a workflow record;
 * {@code POST /api/v1/programs/decompile} turns a record back into a laid-out graph.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/programs")
@RequiredArgsConstructor
@Slf4j
public class ProgramController {

    private final WorkflowCompiler compiler;
    private final WorkflowDecompiler decompiler;
    private final GraphDtoMapper graphMapper;
    private final WorkflowRecordMapper recordMapper;

    @PostMapping("/compile")
    public ResponseEntity<WorkflowRecordDto> compile(@Valid @RequestBody GraphDto graph) {
        log.info("Compiling graph nodes={} edges={}",
                graph.nodes() != null ? graph.nodes().size() : 0, graph.edges() != null ? graph.edges().size() : 0);
        CompiledWorkflow compiled = compiler.compile(graphMapper.toSnapshot(graph));
        return ResponseEntity.ok(recordMapper.toRecord(compiled));
    }

    @PostMapping("/decompile")
    public ResponseEntity<GraphDto> decompile(@Valid @RequestBody WorkflowRecordDto record) {
        log.info("Decompiling workflow triggerType={} steps={}",
                record.triggerType(), record.steps() != null ? record.steps().size() : 0);
        CompiledWorkflow compiled = recordMapper.toCompiled(record);
        return ResponseEntity.ok(graphMapper.toDto(decompiler.decompile(compiled).snapshot()));
    }
}

package com.example.flowcompiler.api.v1;

import com.example.flowcompiler.api.v1.dto.AppendNodeRequest;
import com.example.flowcompiler.api.v1.dto.EdgeDto;
import com.example.flowcompiler.api.v1.dto.GraphDto;
import com.example.flowcompiler.api.v1.dto.NodeDto;
import com.example.flowcompiler.api.v1.dto.NodeUpdateRequest;
import com.example.flowcompiler.api.v1.dto.SessionIdResponse;
import com.example.flowcompiler.api.v1.dto.WorkflowRecordDto;
import com.example.flowcompiler.compiler.CompiledWorkflow;
import com.example.flowcompiler.graph.BranchTag;
import com.example.flowcompiler.graph.GraphEdge;
import com.example.flowcompiler.graph.GraphNode;
import com.example.flowcompiler.mapping.GraphDtoMapper;
import com.example.flowcompiler.mapping.WorkflowRecordMapper;
import com.example.flowcompiler.session.EditingSessionService;
import com.example.flowcompiler.session.LiveCompilationSession;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for live editing sessions.
 * <p>
 * Exposes {@code /api/v1/sessions}: open (POST, optionally seeded with a stored workflow record),
 * read the graph and the latest published program, edit nodes and edges, submit and close.
 * Every edit reschedules the session's debounced compile.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final EditingSessionService sessions;
    private final GraphDtoMapper graphMapper;
    private final WorkflowRecordMapper recordMapper;

    @PostMapping
    public ResponseEntity<SessionIdResponse> open(@Valid @RequestBody(required = false) WorkflowRecordDto stored) {
        LiveCompilationSession session = stored != null
                ? sessions.open(recordMapper.toCompiled(stored))
                : sessions.open();
        log.info("Opened session id={} seeded={}", session.getId(), stored != null);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SessionIdResponse(session.getId()));
    }

    @GetMapping("/{id}/graph")
    public ResponseEntity<GraphDto> graph(@PathVariable UUID id) {
        log.debug("Getting graph of session id={}", id);
        return ResponseEntity.ok(graphMapper.toDto(sessions.get(id).snapshot()));
    }

    @GetMapping("/{id}/program")
    public ResponseEntity<WorkflowRecordDto> program(@PathVariable UUID id) {
        log.debug("Getting latest program of session id={}", id);
        return sessions.get(id).latest()
                .map(recordMapper::toRecord)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/nodes")
    public ResponseEntity<NodeDto> addNode(@PathVariable UUID id, @RequestBody NodeDto node) {
        log.info("Adding node to session id={} kind={} nodeId={}", id, node.kind(), node.id());
        GraphNode added = sessions.get(id).addNode(
                node.id(),
                node.label(),
                graphMapper.toPayload(node.kind(), node.triggerType(), node.actionType(), node.config()),
                graphMapper.toPosition(node.position())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(graphMapper.toDto(added));
    }

    @PostMapping("/{id}/nodes/append")
    public ResponseEntity<NodeDto> appendNode(@PathVariable UUID id, @Valid @RequestBody AppendNodeRequest request) {
        log.info("Appending node to session id={} kind={}", id, request.kind());
        GraphNode appended = sessions.get(id).appendNode(
                graphMapper.toPayload(request.kind(), request.triggerType(), request.actionType(), request.config()),
                request.label()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(graphMapper.toDto(appended));
    }

    @PutMapping("/{id}/nodes/{nodeId}")
    public ResponseEntity<NodeDto> updateNode(@PathVariable UUID id, @PathVariable String nodeId,
                                              @RequestBody NodeUpdateRequest request) {
        log.info("Updating node {} in session id={}", nodeId, id);
        GraphNode updated = sessions.get(id).updateNode(nodeId, node -> graphMapper.applyUpdate(node, request));
        return ResponseEntity.ok(graphMapper.toDto(updated));
    }

    @DeleteMapping("/{id}/nodes/{nodeId}")
    public ResponseEntity<Void> removeNode(@PathVariable UUID id, @PathVariable String nodeId) {
        log.info("Removing node {} from session id={}", nodeId, id);
        sessions.get(id).removeNode(nodeId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/edges")
    public ResponseEntity<EdgeDto> addEdge(@PathVariable UUID id, @Valid @RequestBody EdgeDto edge) {
        log.info("Connecting {} -> {} branch={} in session id={}", edge.source(), edge.target(), edge.branch(), id);
        LiveCompilationSession session = sessions.get(id);
        BranchTag branch = BranchTag.fromWireName(edge.branch());
        GraphEdge added = edge.id() != null && !edge.id().isBlank()
                ? session.addEdge(new GraphEdge(edge.id(), edge.source(), edge.target(), branch))
                : session.connect(edge.source(), edge.target(), branch);
        return ResponseEntity.status(HttpStatus.CREATED).body(graphMapper.toDto(added));
    }

    @PutMapping("/{id}/edges/{edgeId}")
    public ResponseEntity<EdgeDto> reconnectEdge(@PathVariable UUID id, @PathVariable String edgeId,
                                                 @Valid @RequestBody EdgeDto edge) {
        log.info("Reconnecting edge {} to {} -> {} in session id={}", edgeId, edge.source(), edge.target(), id);
        GraphEdge moved = sessions.get(id).reconnect(edgeId, edge.source(), edge.target());
        return ResponseEntity.ok(graphMapper.toDto(moved));
    }

    @DeleteMapping("/{id}/edges/{edgeId}")
    public ResponseEntity<Void> removeEdge(@PathVariable UUID id, @PathVariable String edgeId) {
        log.info("Removing edge {} from session id={}", edgeId, id);
        sessions.get(id).removeEdge(edgeId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<WorkflowRecordDto> submit(@PathVariable UUID id) {
        log.info("Submitting session id={}", id);
        CompiledWorkflow compiled = sessions.submit(id);
        return ResponseEntity.ok(recordMapper.toRecord(compiled));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> close(@PathVariable UUID id) {
        log.info("Closing session id={}", id);
        sessions.close(id);
        return ResponseEntity.noContent().build();
    }
}

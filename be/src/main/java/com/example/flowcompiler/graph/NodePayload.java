package com.example.flowcompiler.graph;

import java.util.Map;

/**
 * Kind-tagged configuration of a graph node.
 * <p>
 * Each implementation carries only the fields of its own kind, so the node kind is always
 * derived from the payload and never stored separately.
 * </p>
 */
public interface NodePayload {

    NodeKind kind();

    /** Opaque configuration, copied verbatim into the compiled instruction. */
    Map<String, Object> config();
}

package com.example.flowcompiler.actions;

import java.util.List;
import java.util.Optional;

/**
 * Catalog of action types an action node can be configured with. Used by the editor to offer
 * choices and config fields; compilation never consults it.
 */
public interface ActionCatalog {

    /**
     * Returns the definition for the given action type, or empty for unknown types.
     */
    Optional<ActionDefinition> find(String actionType);

    /**
     * Returns all known definitions, sorted by action type.
     */
    List<ActionDefinition> all();
}

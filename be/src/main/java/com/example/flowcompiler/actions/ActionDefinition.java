package com.example.flowcompiler.actions;

import java.util.List;
import java.util.Objects;

/**
 * Config contract of one action type: which keys an action node's config must and may carry.
 */
public record ActionDefinition(String actionType, String description, List<String> requiredFields, List<String> optionalFields) {

    public ActionDefinition {
        Objects.requireNonNull(actionType, "actionType");
        description = description != null ? description : "";
        requiredFields = requiredFields != null ? List.copyOf(requiredFields) : List.of();
        optionalFields = optionalFields != null ? List.copyOf(optionalFields) : List.of();
    }
}

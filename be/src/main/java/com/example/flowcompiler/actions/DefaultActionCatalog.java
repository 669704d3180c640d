package com.example.flowcompiler.actions;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link ActionCatalog} with the built-in action types.
 */
@Component
public class DefaultActionCatalog implements ActionCatalog {

    private static final List<ActionDefinition> DEFINITIONS = List.of(
            new ActionDefinition("send_email", "Send an email",
                    List.of("to", "subject", "body_html"), List.of("cc", "bcc", "body_text", "from_name")),
            new ActionDefinition("send_notification", "Send an in-app notification",
                    List.of("title", "message"), List.of("user_id", "user_field", "type", "metadata")),
            new ActionDefinition("send_slack", "Post a message to a Slack channel",
                    List.of("channel", "message"), List.of("notify_channel", "use_blocks", "username", "icon_emoji")),
            new ActionDefinition("create_task", "Create a project task",
                    List.of("project_field", "title", "description", "priority", "status"),
                    List.of("assignee_field", "due_date_offset_days", "tags")),
            new ActionDefinition("update_task", "Update an existing task",
                    List.of("updates"), List.of("task_id", "task_field")),
            new ActionDefinition("add_tag", "Add a tag to a contact or company",
                    List.of("entity_type", "entity_field", "tag_name"), List.of()),
            new ActionDefinition("remove_tag", "Remove a tag from a contact or company",
                    List.of("entity_type", "entity_field", "tag_name"), List.of()),
            new ActionDefinition("webhook_call", "Call an external HTTP endpoint",
                    List.of("url", "method"), List.of("headers", "body_template", "output_field", "timeout_ms")),
            new ActionDefinition("ai_generate", "Generate text from a prompt template",
                    List.of("prompt_template", "output_field"), List.of("structured"))
    );

    private static final Map<String, ActionDefinition> BY_TYPE = DEFINITIONS.stream()
            .collect(Collectors.toUnmodifiableMap(ActionDefinition::actionType, Function.identity()));

    @Override
    public Optional<ActionDefinition> find(String actionType) {
        if (actionType == null || actionType.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TYPE.get(actionType.trim()));
    }

    @Override
    public List<ActionDefinition> all() {
        return DEFINITIONS.stream()
                .sorted(Comparator.comparing(ActionDefinition::actionType))
                .collect(Collectors.toList());
    }
}

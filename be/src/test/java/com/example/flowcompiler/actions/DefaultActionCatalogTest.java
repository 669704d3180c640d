package com.example.flowcompiler.actions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DefaultActionCatalog")
class DefaultActionCatalogTest {

    private final DefaultActionCatalog catalog = new DefaultActionCatalog();

    @Test
    @DisplayName("describes send_email with its required and optional fields")
    void sendEmail() {
        ActionDefinition email = catalog.find("send_email").orElseThrow();

        assertEquals(List.of("to", "subject", "body_html"), email.requiredFields());
        assertTrue(email.optionalFields().containsAll(List.of("cc", "bcc")));
    }

    @Test
    @DisplayName("returns nothing for unknown or blank action types")
    void unknownTypes() {
        assertTrue(catalog.find("teleport").isEmpty());
        assertTrue(catalog.find(" ").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
    }

    @Test
    @DisplayName("lists all action types sorted")
    void listsSorted() {
        List<String> types = catalog.all().stream().map(ActionDefinition::actionType).toList();

        assertEquals(List.of("add_tag", "ai_generate", "create_task", "remove_tag", "send_email",
                "send_notification", "send_slack", "update_task", "webhook_call"), types);
    }
}

package me.golemcore.promptforge.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonMappingException;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptStageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldFollowStageSequence() {
        assertEquals(Optional.of(PromptStage.PAGE_UI), PromptStage.APP_SKELETON.next());
        assertEquals(Optional.of(PromptStage.FLOW_CONNECTIONS), PromptStage.PAGE_UI.next());
        assertEquals(Optional.of(PromptStage.FEATURE_SPECIFIC), PromptStage.FLOW_CONNECTIONS.next());
        assertEquals(Optional.of(PromptStage.OPTIMIZATION), PromptStage.FEATURE_SPECIFIC.next());
        assertEquals(Optional.of(PromptStage.OPTIMIZATION), PromptStage.DEBUGGING.next());
        assertTrue(PromptStage.OPTIMIZATION.next().isEmpty());
    }

    @Test
    void shouldResolveWireValuesAndAliases() {
        assertEquals(Optional.of(PromptStage.APP_SKELETON), PromptStage.fromValue("app_skeleton"));
        assertEquals(Optional.of(PromptStage.APP_SKELETON), PromptStage.fromValue("skeleton"));
        assertEquals(Optional.of(PromptStage.PAGE_UI), PromptStage.fromValue(" Page-UI "));
        assertTrue(PromptStage.fromValue("teleport").isEmpty());
        assertTrue(PromptStage.fromValue(null).isEmpty());
        assertTrue(PromptStage.fromValue("  ").isEmpty());
    }

    @Test
    void shouldMapStagesToTaskAndTemplateTypes() {
        assertEquals("app_architecture", PromptStage.APP_SKELETON.getTaskType());
        assertEquals(TemplateType.SKELETON, PromptStage.APP_SKELETON.getTemplateType());
        assertEquals("navigation_flow", PromptStage.FLOW_CONNECTIONS.getTaskType());
        assertEquals(TemplateType.DEBUGGING, PromptStage.DEBUGGING.getTemplateType());
    }

    @Test
    void shouldSerializeAsWireValue() throws Exception {
        assertEquals("\"flow_connections\"", objectMapper.writeValueAsString(PromptStage.FLOW_CONNECTIONS));
        assertEquals(PromptStage.OPTIMIZATION, objectMapper.readValue("\"optimization\"", PromptStage.class));
    }

    @Test
    void shouldRejectUnknownStageInJson() {
        assertThrows(JsonMappingException.class,
                () -> objectMapper.readValue("\"teleport\"", PromptStage.class));
    }
}

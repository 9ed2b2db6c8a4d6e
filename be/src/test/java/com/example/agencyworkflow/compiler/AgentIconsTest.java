package com.example.agencyworkflow.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("AgentIcons")
class AgentIconsTest {

    @Test
    @DisplayName("matches keywords case-insensitively")
    void caseInsensitive() {
        assertEquals("📊", AgentIcons.iconFor("DATA Loader"));
        assertEquals("📧", AgentIcons.iconFor("Email sender"));
    }

    @Test
    @DisplayName("first matching rule wins")
    void firstMatchWins() {
        // "support" comes before "data" in the table
        assertEquals("👥", AgentIcons.iconFor("Data support desk"));
    }

    @Test
    @DisplayName("falls back to the default icon")
    void defaultIcon() {
        assertEquals(AgentIcons.DEFAULT_ICON, AgentIcons.iconFor("Planner"));
        assertEquals(AgentIcons.DEFAULT_ICON, AgentIcons.iconFor(null));
    }
}

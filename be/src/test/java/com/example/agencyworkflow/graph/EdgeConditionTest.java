package com.example.agencyworkflow.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tools.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("EdgeCondition")
class EdgeConditionTest {

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    @Test
    @DisplayName("writes single-key wire objects")
    void wireForm() {
        assertEquals("{\"onFailure\":null}", jsonMapper.writeValueAsString(EdgeCondition.onFailure()));
        assertEquals("{\"ifEquals\":{\"field\":\"status\",\"value\":\"ok\"}}",
                jsonMapper.writeValueAsString(EdgeCondition.ifEquals("status", "ok")));
    }

    @Test
    @DisplayName("resolves several keys by fixed precedence")
    void precedence() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("ifEquals", Map.of("field", "f", "value", "v"));
        raw.put("ifContains", Map.of("field", "g", "value", "w"));

        assertEquals(EdgeCondition.ifContains("g", "w"), EdgeCondition.fromJson(raw));

        raw.put("always", null);
        assertEquals(EdgeCondition.always(), EdgeCondition.fromJson(raw));

        raw.put("onFailure", null);
        assertEquals(EdgeCondition.onFailure(), EdgeCondition.fromJson(raw));

        raw.put("onSuccess", null);
        assertEquals(EdgeCondition.onSuccess(), EdgeCondition.fromJson(raw));
    }

    @Test
    @DisplayName("empty or unknown objects fall back to always")
    void fallback() {
        assertEquals(EdgeCondition.always(), EdgeCondition.fromJson(Map.of()));
        assertEquals(EdgeCondition.always(), EdgeCondition.fromJson(Map.of("sometimes", true)));
        assertEquals(EdgeCondition.always(), EdgeCondition.fromJson(null));
    }

    @Test
    @DisplayName("reads the wire form back")
    void readsWireForm() {
        assertEquals(EdgeCondition.ifEquals("status", "ok"),
                jsonMapper.readValue("{\"ifEquals\":{\"field\":\"status\",\"value\":\"ok\"}}", EdgeCondition.class));
        assertEquals(EdgeCondition.onSuccess(), jsonMapper.readValue("{\"onSuccess\":null}", EdgeCondition.class));
    }
}

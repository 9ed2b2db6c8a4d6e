package com.example.agencyworkflow.compiler;

import com.example.agencyworkflow.graph.EdgeCondition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ConditionLabels")
class ConditionLabelsTest {

    @Test
    @DisplayName("labels each condition kind")
    void labels() {
        assertEquals("On Success", ConditionLabels.label(EdgeCondition.onSuccess()));
        assertEquals("On Failure", ConditionLabels.label(EdgeCondition.onFailure()));
        assertEquals("Always", ConditionLabels.label(EdgeCondition.always()));
        assertEquals("If Contains: tags = urgent", ConditionLabels.label(EdgeCondition.ifContains("tags", "urgent")));
        assertEquals("If Equals: status = ok", ConditionLabels.label(EdgeCondition.ifEquals("status", "ok")));
    }

    @Test
    @DisplayName("onSuccess wins over always when both keys are present")
    void onSuccessBeatsAlways() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("always", null);
        raw.put("onSuccess", null);

        assertEquals("On Success", ConditionLabels.label(EdgeCondition.fromJson(raw)));
    }

    @Test
    @DisplayName("onFailure wins over ifEquals")
    void onFailureBeatsIfEquals() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("ifEquals", Map.of("field", "a", "value", "b"));
        raw.put("onFailure", null);

        assertEquals("On Failure", ConditionLabels.label(EdgeCondition.fromJson(raw)));
    }
}

package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Branch predicate carried by an edge or compiled connection. Evaluated by the execution
 * runtime, never by the compiler.
 * <p>
 * On the wire a condition is a single-key object such as {@code {"onSuccess": null}} or
 * {@code {"ifEquals": {"field": "status", "value": "ok"}}}. An object carrying several keys
 * resolves by the fixed precedence onSuccess, onFailure, always, ifContains, ifEquals and
 * falls back to {@link Always}.
 * </p>
 */
public sealed interface EdgeCondition
        permits EdgeCondition.Always, EdgeCondition.OnSuccess, EdgeCondition.OnFailure,
        EdgeCondition.IfContains, EdgeCondition.IfEquals {

    String ALWAYS_KEY = "always";
    String ON_SUCCESS_KEY = "onSuccess";
    String ON_FAILURE_KEY = "onFailure";
    String IF_CONTAINS_KEY = "ifContains";
    String IF_EQUALS_KEY = "ifEquals";

    record Always() implements EdgeCondition {
    }

    record OnSuccess() implements EdgeCondition {
    }

    record OnFailure() implements EdgeCondition {
    }

    record IfContains(String field, String value) implements EdgeCondition {
        public IfContains {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    record IfEquals(String field, String value) implements EdgeCondition {
        public IfEquals {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }
    }

    static EdgeCondition always() {
        return new Always();
    }

    static EdgeCondition onSuccess() {
        return new OnSuccess();
    }

    static EdgeCondition onFailure() {
        return new OnFailure();
    }

    static EdgeCondition ifContains(String field, String value) {
        return new IfContains(field, value);
    }

    static EdgeCondition ifEquals(String field, String value) {
        return new IfEquals(field, value);
    }

    default boolean isAlways() {
        return this instanceof Always;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static EdgeCondition fromJson(Map<String, Object> raw) {
        if (raw == null) {
            return always();
        }
        if (raw.containsKey(ON_SUCCESS_KEY)) {
            return onSuccess();
        }
        if (raw.containsKey(ON_FAILURE_KEY)) {
            return onFailure();
        }
        if (raw.containsKey(ALWAYS_KEY)) {
            return always();
        }
        if (raw.get(IF_CONTAINS_KEY) instanceof Map<?, ?> payload) {
            return ifContains(text(payload.get("field")), text(payload.get("value")));
        }
        if (raw.get(IF_EQUALS_KEY) instanceof Map<?, ?> payload) {
            return ifEquals(text(payload.get("field")), text(payload.get("value")));
        }
        return always();
    }

    @JsonValue
    default Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        if (this instanceof OnSuccess) {
            json.put(ON_SUCCESS_KEY, null);
        } else if (this instanceof OnFailure) {
            json.put(ON_FAILURE_KEY, null);
        } else if (this instanceof IfContains c) {
            json.put(IF_CONTAINS_KEY, payload(c.field(), c.value()));
        } else if (this instanceof IfEquals c) {
            json.put(IF_EQUALS_KEY, payload(c.field(), c.value()));
        } else {
            json.put(ALWAYS_KEY, null);
        }
        return json;
    }

    private static Map<String, Object> payload(String field, String value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("field", field);
        payload.put("value", value);
        return payload;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : "";
    }
}

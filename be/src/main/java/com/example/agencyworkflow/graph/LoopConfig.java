package com.example.agencyworkflow.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loop wrapped around a step. Interpreted by the execution runtime only.
 * Wire form is a single-key object: {@code none}, {@code forEach}, {@code whileLoop} or {@code repeat}.
 */
public sealed interface LoopConfig
        permits LoopConfig.None, LoopConfig.ForEach, LoopConfig.WhileLoop, LoopConfig.Repeat {

    record None() implements LoopConfig {
    }

    record ForEach(String arraySource, String itemVariable, String indexVariable, Integer maxIterations)
            implements LoopConfig {
    }

    record WhileLoop(String condition, Integer maxIterations) implements LoopConfig {
    }

    record Repeat(int count, String indexVariable) implements LoopConfig {
    }

    static LoopConfig none() {
        return new None();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static LoopConfig fromJson(Map<String, Object> raw) {
        if (raw == null) {
            return null;
        }
        if (raw.get("forEach") instanceof Map<?, ?> p) {
            return new ForEach(text(p.get("arraySource")), text(p.get("itemVariable")),
                    text(p.get("indexVariable")), integer(p.get("maxIterations")));
        }
        if (raw.get("whileLoop") instanceof Map<?, ?> p) {
            return new WhileLoop(text(p.get("condition")), integer(p.get("maxIterations")));
        }
        if (raw.get("repeat") instanceof Map<?, ?> p) {
            Integer count = integer(p.get("count"));
            return new Repeat(count != null ? count : 0, text(p.get("indexVariable")));
        }
        return none();
    }

    @JsonValue
    default Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        if (this instanceof ForEach f) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("arraySource", f.arraySource());
            p.put("itemVariable", f.itemVariable());
            p.put("indexVariable", f.indexVariable());
            putIfPresent(p, "maxIterations", f.maxIterations());
            json.put("forEach", p);
        } else if (this instanceof WhileLoop w) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("condition", w.condition());
            putIfPresent(p, "maxIterations", w.maxIterations());
            json.put("whileLoop", p);
        } else if (this instanceof Repeat r) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("count", r.count());
            putIfPresent(p, "indexVariable", r.indexVariable());
            json.put("repeat", p);
        } else {
            json.put("none", null);
        }
        return json;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Integer integer(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            return Integer.valueOf(s.trim());
        }
        return null;
    }
}

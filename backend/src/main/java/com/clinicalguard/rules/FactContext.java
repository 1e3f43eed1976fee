package com.clinicalguard.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable set of named inputs that rules read. Built once per evaluation.
 *
 * Values keep their JSON shape: numbers, strings, booleans, lists and nested
 * maps. Nested values are reachable through dotted paths such as
 * {@code vitals.systolicBp}; a numeric segment indexes into a list.
 */
public final class FactContext {

    private static final FactContext EMPTY = new FactContext(Map.of());

    private final Map<String, Object> facts;

    private FactContext(Map<String, Object> facts) {
        this.facts = facts;
    }

    public static FactContext empty() {
        return EMPTY;
    }

    public static FactContext of(Map<String, ?> facts) {
        if (facts == null || facts.isEmpty()) {
            return EMPTY;
        }
        return new FactContext(freezeMap(facts));
    }

    /**
     * Value at {@code path}, or {@code null} when absent.
     */
    public Object lookup(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        if (facts.containsKey(path)) {
            return facts.get(path);
        }
        Object current = facts;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                current = elementAt(list, segment);
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static Object elementAt(List<?> list, String segment) {
        if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit) || segment.length() > 9) {
            return null;
        }
        int index = Integer.parseInt(segment);
        return index < list.size() ? list.get(index) : null;
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new TreeMap<>();
        source.forEach((k, v) -> {
            if (k != null) {
                copy.put(String.valueOf(k), freeze(v));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}

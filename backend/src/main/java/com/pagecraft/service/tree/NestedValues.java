package com.pagecraft.service.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies prop and style values so nested maps and lists are never shared
 * between the arena and its callers. Nested containers come back unmodifiable.
 */
final class NestedValues {

    private NestedValues() {}

    static Map<String, Object> copyEntries(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, copyValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object nested : list) {
                copy.add(copyValue(nested));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}

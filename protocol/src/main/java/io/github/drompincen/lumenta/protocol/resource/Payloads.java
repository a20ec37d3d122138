package io.github.drompincen.lumenta.protocol.resource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, null-tolerant immutable copies of free-form JSON payloads (workflow config,
 * trace input/output, integration config).
 */
public final class Payloads {

    private Payloads() {}

    public static Map<String, Object> freeze(Map<String, ?> source) {
        if (source == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, freezeValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    public static Map<String, Object> freezeOrEmpty(Map<String, ?> source) {
        return source == null ? Map.of() : freeze(source);
    }

    public static <T> List<T> list(List<T> source) {
        return source == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(source));
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freeze((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(freezeValue(item));
            }
            return Collections.unmodifiableList(items);
        }
        return value;
    }
}

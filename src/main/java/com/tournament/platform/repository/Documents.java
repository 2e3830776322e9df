package com.tournament.platform.repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers shared by the store implementations.
 */
public final class Documents {
    
    private Documents() {
    }
    
    /**
     * Copies nested maps and lists so that callers never share mutable state with the store.
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?>) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) value).forEach((k, v) -> copy.put(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?>) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return value;
    }
    
    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyOf(Map<String, Object> document) {
        return (Map<String, Object>) deepCopy(document);
    }
    
    /**
     * Document ready to be stored as-is: transforms resolved against an empty document.
     */
    public static Map<String, Object> resolve(Map<String, Object> document, Instant now) {
        return merge(new LinkedHashMap<>(), document, now);
    }
    
    /**
     * New document with {@code fields} merged over {@code current}. Neither argument is modified.
     */
    public static Map<String, Object> merge(Map<String, Object> current, Map<String, Object> fields, Instant now) {
        Map<String, Object> merged = copyOf(current);
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof FieldValue) {
                merged.put(entry.getKey(), ((FieldValue) value).apply(merged.get(entry.getKey()), now));
            } else {
                merged.put(entry.getKey(), deepCopy(value));
            }
        }
        return merged;
    }
}

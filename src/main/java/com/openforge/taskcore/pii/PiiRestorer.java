package com.openforge.taskcore.pii;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inverse of {@link PiiTokenizer}: puts original values back into whatever
 * structure the extraction model returned.
 *
 * Strings get every placeholder substituted; maps are restored value by value
 * (keys are left alone); lists element by element; numbers, booleans and null
 * pass through. Nesting deeper than {@link #MAX_DEPTH} is returned untouched.
 */
@Slf4j
@Component
public class PiiRestorer {

    static final int MAX_DEPTH = 64;

    public Object restore(Object data, Map<String, PiiToken> piiMap) {
        if (piiMap == null || piiMap.isEmpty()) return data;
        return restore(data, piiMap, 0);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> restoreMap(Map<String, Object> data, Map<String, PiiToken> piiMap) {
        return (Map<String, Object>) restore(data, piiMap);
    }

    private Object restore(Object value, Map<String, PiiToken> piiMap, int depth) {
        if (value == null) return null;
        if (value instanceof String s) return restoreString(s, piiMap);
        if (!(value instanceof Map<?, ?>) && !(value instanceof Collection<?>)) return value;

        if (depth >= MAX_DEPTH) {
            log.warn("[PII] Structure nested deeper than {} levels, leaving remainder unrestored", MAX_DEPTH);
            return value;
        }

        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> restored = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                restored.put(e.getKey(), restore(e.getValue(), piiMap, depth + 1));
            }
            return restored;
        }

        Collection<?> items = (Collection<?>) value;
        List<Object> restored = new ArrayList<>(items.size());
        for (Object item : items) {
            restored.add(restore(item, piiMap, depth + 1));
        }
        return restored;
    }

    private static String restoreString(String s, Map<String, PiiToken> piiMap) {
        String out = s;
        for (Map.Entry<String, PiiToken> e : piiMap.entrySet()) {
            if (out.contains(e.getKey())) {
                out = out.replace(e.getKey(), e.getValue().originalValue());
            }
        }
        return out;
    }
}

package com.o2o.analytics.infrastructure.cache;

import com.o2o.analytics.domain.model.TimeWindow;
import lombok.Value;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cache key of a definition query. The rendered form starts with the
 * definition id so all entries of a definition share a prefix.
 */
@Value
public class CacheKey {

    String definitionId;
    String fingerprint;

    public static CacheKey of(String definitionId, Map<String, String> filters, TimeWindow window) {
        String filterPart = new TreeMap<>(filters).entrySet().stream()
                .map(e -> lengthPrefixed(e.getKey()) + "=" + lengthPrefixed(e.getValue()))
                .collect(Collectors.joining(","));
        return new CacheKey(definitionId, (filterPart.isEmpty() ? "*" : filterPart) + ":" + window);
    }

    // filter values are free text; the length makes separators inside them harmless
    private static String lengthPrefixed(String part) {
        String value = part == null ? "" : part;
        return value.length() + "#" + value;
    }

    public String render(String prefix) {
        return definitionPrefix(prefix, definitionId) + fingerprint;
    }

    public static String definitionPrefix(String prefix, String definitionId) {
        return prefix + ":" + definitionId + ":";
    }

    @Override
    public String toString() {
        return definitionId + ":" + fingerprint;
    }
}

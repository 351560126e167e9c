package com.fleetrun.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes the free-form maps a worker reports with a result.
 *
 * <p>Worker payloads are JSON, so any cell or list may be {@code null}. Test data
 * keeps every key with {@code null} values read as {@code ""}; artifacts drop
 * {@code null} kinds, lists and entries. Key order is preserved.
 */
public final class ResultData {

    private ResultData() {}

    public static Map<String, String> testData(Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, String>();
        data.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value != null ? value : "");
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    public static Map<String, List<String>> artifacts(Map<String, List<String>> artifacts) {
        if (artifacts == null || artifacts.isEmpty()) {
            return Map.of();
        }
        var copy = new LinkedHashMap<String, List<String>>();
        artifacts.forEach((kind, refs) -> {
            if (kind == null || refs == null) {
                return;
            }
            var kept = new ArrayList<String>(refs.size());
            for (String ref : refs) {
                if (ref != null) {
                    kept.add(ref);
                }
            }
            copy.put(kind, List.copyOf(kept));
        });
        return Collections.unmodifiableMap(copy);
    }
}

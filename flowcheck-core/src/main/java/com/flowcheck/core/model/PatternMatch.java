package com.flowcheck.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One occurrence of an error pattern found by {@code checkErrorPattern}.
 *
 * @param line source line, may be null
 * @param pattern diagnostic code of the occurrence
 * @param suggestion fix text
 */
public record PatternMatch(Integer line, String pattern, String suggestion) {

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("line", line);
        wire.put("pattern", pattern);
        wire.put("suggestion", suggestion);
        return wire;
    }
}

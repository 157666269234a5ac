package com.flowcheck.core.validator.impl;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default {@link FieldNameHeuristic}.
 *
 * <p>A name is suspicious when it contains one of the placeholder markers
 * ({@code nonexistent}, {@code invalid}, {@code fake}) and neither the name nor the
 * first segment of a dotted path is on the allow list. The allow list holds common
 * field names and can be extended through configuration.</p>
 */
public class AllowListFieldNameHeuristic implements FieldNameHeuristic {

    static final List<String> COMMON_FIELD_NAMES = List.of(
        "result", "data", "output", "input", "response", "content", "text", "value",
        "items", "records", "rows", "message", "messages", "status", "error", "errors",
        "metadata", "params", "parameters", "config", "query", "prompt", "answer",
        "documents", "context", "payload", "body", "headers", "feedback", "iteration"
    );

    static final List<String> MARKERS = List.of("nonexistent", "invalid", "fake");

    private final Set<String> allowed;

    public AllowListFieldNameHeuristic() {
        this(List.of());
    }

    /**
     * @param extraNames field names accepted in addition to the common ones
     */
    public AllowListFieldNameHeuristic(Collection<String> extraNames) {
        Set<String> names = new LinkedHashSet<>(COMMON_FIELD_NAMES);
        if (extraNames != null) {
            names.addAll(extraNames);
        }
        this.allowed = Set.copyOf(names);
    }

    @Override
    public boolean isSuspicious(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return false;
        }
        int dot = fieldName.indexOf('.');
        String head = dot >= 0 ? fieldName.substring(0, dot) : fieldName;
        if (allowed.contains(fieldName) || allowed.contains(head)) {
            return false;
        }
        String lower = fieldName.toLowerCase(Locale.ROOT);
        return MARKERS.stream().anyMatch(lower::contains);
    }
}

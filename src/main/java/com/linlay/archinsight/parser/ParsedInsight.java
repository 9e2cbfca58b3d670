package com.linlay.archinsight.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort structure recovered from a reply. Every key is optional: lookups of absent keys
 * return an empty string or an empty list. Maps keep the order in which the schema lists its fields.
 *
 * @param fallbackSummary first substantial paragraph, set only when nothing else was recovered
 * @param rawContent      the reply, verbatim
 * @param warnings        parse diagnostics, one per flagged item
 */
public record ParsedInsight(
        Map<String, String> sections,
        Map<String, List<String>> lists,
        Map<String, List<StructuredItem>> structuredItems,
        String fallbackSummary,
        String rawContent,
        List<String> warnings
) {

    public ParsedInsight {
        sections = ordered(sections);
        lists = ordered(lists);
        structuredItems = ordered(structuredItems);
        fallbackSummary = fallbackSummary == null ? "" : fallbackSummary;
        rawContent = rawContent == null ? "" : rawContent;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String section(String key) {
        return sections.getOrDefault(key, "");
    }

    public List<String> list(String key) {
        return lists.getOrDefault(key, List.of());
    }

    public List<StructuredItem> items(String key) {
        return structuredItems.getOrDefault(key, List.of());
    }

    public boolean hasStructuredContent() {
        return sections.values().stream().anyMatch(value -> !value.isBlank())
                || lists.values().stream().anyMatch(values -> !values.isEmpty())
                || structuredItems.values().stream().anyMatch(values -> !values.isEmpty());
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

package com.linlay.archinsight.parser;

import java.util.List;
import java.util.Optional;

public class SectionExtractor {

    private final List<SectionStrategy> strategies;
    private final int minSectionLength;

    public SectionExtractor(List<SectionStrategy> strategies, int minSectionLength) {
        this.strategies = strategies == null || strategies.isEmpty()
                ? SectionStrategies.DEFAULT_ORDER
                : List.copyOf(strategies);
        this.minSectionLength = Math.max(0, minSectionLength);
    }

    public Optional<String> extract(String text, String sectionName) {
        for (SectionStrategy strategy : strategies) {
            Optional<String> captured = strategy.extract(text, sectionName);
            if (captured.isPresent() && captured.get().trim().length() > minSectionLength) {
                return Optional.of(captured.get().trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Tries each name in turn and returns the first section found.
     */
    public Optional<String> extractAny(String text, List<String> sectionNames) {
        for (String name : sectionNames) {
            Optional<String> section = extract(text, name);
            if (section.isPresent()) {
                return section;
            }
        }
        return Optional.empty();
    }
}

package com.linlay.archinsight.parser;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@link SectionStrategy} defined by a regular expression template whose {@code %s} is replaced
 * by the quoted section name and whose first group is the section body.
 */
public final class HeadingPatternStrategy implements SectionStrategy {

    private final String name;
    private final String template;
    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public HeadingPatternStrategy(String name, String template) {
        this.name = name;
        this.template = template;
    }

    public String name() {
        return name;
    }

    @Override
    public Optional<String> extract(String text, String sectionName) {
        if (text == null || text.isEmpty() || sectionName == null || sectionName.isBlank()) {
            return Optional.empty();
        }
        Pattern pattern = compiled.computeIfAbsent(sectionName.trim(), key -> Pattern.compile(
                String.format(template, Pattern.quote(key)),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        ));
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find() || matcher.group(1) == null) {
            return Optional.empty();
        }
        String cleaned = matcher.group(1).trim();
        return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
    }

    @Override
    public String toString() {
        return name;
    }
}

package com.linlay.archinsight.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds title/description/files/functions records from labelled lines. A {@code Title:} line or a
 * {@code - Label: text} bullet opens a record; unlabelled lines extend its description. Unlabelled
 * lines ahead of the first record belong to no record and are dropped.
 */
public class StructuredItemExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuredItemExtractor.class);

    private static final Pattern LABELLED = Pattern.compile(
            "^(?:\\*\\*)?(title|description|files|functions)(?:\\*\\*)?\\s*:(?:\\*\\*)?\\s*(.+)$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern INLINE = Pattern.compile("^(?:[-•*]|\\d+[.)])\\s+(.+?):\\s*(.+)$");
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.+?)\\*\\*");

    public List<StructuredItem> extract(String sectionText) {
        List<StructuredItem> items = new ArrayList<>();
        if (sectionText == null || sectionText.isBlank()) {
            return items;
        }
        Draft current = null;
        for (String line : sectionText.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher labelled = LABELLED.matcher(ListItemExtractor.stripMarker(trimmed));
            if (labelled.matches()) {
                String value = labelled.group(2).trim();
                switch (labelled.group(1).toLowerCase(Locale.ROOT)) {
                    case "title" -> {
                        if (current != null) {
                            items.add(current.build());
                        }
                        current = new Draft(value);
                    }
                    case "description" -> {
                        if (current != null) {
                            current.description = new StringBuilder(value);
                        }
                    }
                    case "files" -> {
                        if (current != null) {
                            current.files = splitList(value);
                        }
                    }
                    default -> {
                        if (current != null) {
                            current.functions = splitList(value);
                        }
                    }
                }
                continue;
            }
            Matcher inline = INLINE.matcher(trimmed);
            if (inline.matches()) {
                if (current != null) {
                    items.add(current.build());
                }
                current = new Draft(unbold(inline.group(1).trim()));
                current.description.append(inline.group(2).trim());
                continue;
            }
            if (current != null) {
                current.appendDescription(trimmed);
            } else {
                log.debug("Dropping line ahead of the first record: {}", trimmed);
            }
        }
        if (current != null) {
            items.add(current.build());
        }
        return items;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .toList();
    }

    private static String unbold(String text) {
        return BOLD.matcher(text).replaceAll("$1").trim();
    }

    private static final class Draft {
        private final String title;
        private StringBuilder description = new StringBuilder();
        private List<String> files = List.of();
        private List<String> functions = List.of();

        private Draft(String title) {
            this.title = title;
        }

        private void appendDescription(String line) {
            if (description.length() > 0) {
                description.append('\n');
            }
            description.append(line);
        }

        private StructuredItem build() {
            return new StructuredItem(title, description.toString(), files, functions);
        }
    }
}

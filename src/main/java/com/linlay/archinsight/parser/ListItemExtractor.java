package com.linlay.archinsight.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a section into list items. A marker line ({@code -}, {@code •}, {@code *}, {@code 1.},
 * {@code 1)}) opens an item; following non-blank lines continue it; blank lines are skipped.
 */
public class ListItemExtractor {

    static final Pattern ITEM_MARKER = Pattern.compile("^(?:[-•*]|\\d+[.)])\\s+");

    public List<String> extract(String sectionText) {
        List<String> items = new ArrayList<>();
        if (sectionText == null || sectionText.isBlank()) {
            return items;
        }
        List<String> current = new ArrayList<>();
        for (String line : sectionText.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (startsItem(trimmed)) {
                flush(current, items);
                current.add(trimmed);
            } else if (!trimmed.isEmpty() && !current.isEmpty()) {
                current.add(trimmed);
            }
        }
        flush(current, items);
        return items;
    }

    static boolean startsItem(String trimmedLine) {
        return ITEM_MARKER.matcher(trimmedLine).find();
    }

    static String stripMarker(String text) {
        return ITEM_MARKER.matcher(text).replaceFirst("").trim();
    }

    private void flush(List<String> current, List<String> items) {
        if (current.isEmpty()) {
            return;
        }
        String item = stripMarker(String.join("\n", current).trim());
        current.clear();
        if (!item.isEmpty()) {
            items.add(item);
        }
    }
}

package com.linlay.archinsight.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags issue items whose "Proposed Fix" label is followed by too little text. Flagged items are
 * kept.
 */
public class ProposedFixValidator {

    private static final Pattern LABEL = Pattern.compile(
            "(?:\\*\\*)?Proposed Fix(?:\\*\\*)?\\s*:(?:\\*\\*)?",
            Pattern.CASE_INSENSITIVE
    );

    private final int minFixLength;
    private final int previewChars;

    public ProposedFixValidator(int minFixLength, int previewChars) {
        this.minFixLength = minFixLength;
        this.previewChars = previewChars;
    }

    public Optional<String> validate(String item) {
        if (item == null) {
            return Optional.empty();
        }
        Matcher label = LABEL.matcher(item);
        if (!label.find()) {
            return Optional.empty();
        }
        String fix = item.substring(label.end()).trim();
        if (fix.length() >= minFixLength) {
            return Optional.empty();
        }
        String preview = item.length() > previewChars ? item.substring(0, previewChars) : item;
        return Optional.of("Issue found with empty or very short Proposed Fix: " + preview);
    }
}

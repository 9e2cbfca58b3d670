package com.linlay.archinsight.parser;

/**
 * Thresholds of the tolerant parser.
 *
 * @param minSectionLength           a section capture is accepted only when its trimmed text is longer
 * @param minProposedFixLength       shorter "Proposed Fix" texts raise a warning
 * @param warningPreviewChars        length of the item preview quoted in a warning
 * @param fallbackParagraphMinLength paragraphs must be longer to serve as fallback summary
 */
public record ParserSettings(
        int minSectionLength,
        int minProposedFixLength,
        int warningPreviewChars,
        int fallbackParagraphMinLength
) {

    public static final ParserSettings DEFAULTS = new ParserSettings(10, 10, 200, 50);

    public ParserSettings {
        if (minSectionLength < 0) {
            minSectionLength = DEFAULTS.minSectionLength;
        }
        if (minProposedFixLength < 0) {
            minProposedFixLength = DEFAULTS.minProposedFixLength;
        }
        if (warningPreviewChars <= 0) {
            warningPreviewChars = DEFAULTS.warningPreviewChars;
        }
        if (fallbackParagraphMinLength < 0) {
            fallbackParagraphMinLength = DEFAULTS.fallbackParagraphMinLength;
        }
    }
}

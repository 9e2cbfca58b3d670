package com.linlay.archinsight.config;

import com.linlay.archinsight.parser.ParserSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "insight.parser")
public record InsightParserProperties(
        int minSectionLength,
        int minProposedFixLength,
        int warningPreviewChars,
        int fallbackParagraphMinLength
) {

    public InsightParserProperties {
        ParserSettings defaults = ParserSettings.DEFAULTS;
        if (minSectionLength <= 0) {
            minSectionLength = defaults.minSectionLength();
        }
        if (minProposedFixLength <= 0) {
            minProposedFixLength = defaults.minProposedFixLength();
        }
        if (warningPreviewChars <= 0) {
            warningPreviewChars = defaults.warningPreviewChars();
        }
        if (fallbackParagraphMinLength <= 0) {
            fallbackParagraphMinLength = defaults.fallbackParagraphMinLength();
        }
    }

    public ParserSettings toSettings() {
        return new ParserSettings(minSectionLength, minProposedFixLength, warningPreviewChars, fallbackParagraphMinLength);
    }
}

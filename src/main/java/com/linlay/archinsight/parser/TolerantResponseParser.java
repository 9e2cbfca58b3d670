package com.linlay.archinsight.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns free-form generation output into a {@link ParsedInsight}. Never throws on malformed input;
 * missing structure yields empty fields, and a reply with no recognisable structure at all keeps
 * its first substantial paragraph as a fallback summary.
 */
public class TolerantResponseParser {

    private static final Logger log = LoggerFactory.getLogger(TolerantResponseParser.class);
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\r?\\n\\s*\\r?\\n");

    private final ParserSettings settings;
    private final SectionExtractor sections;
    private final ListItemExtractor listItems = new ListItemExtractor();
    private final StructuredItemExtractor structuredItems = new StructuredItemExtractor();
    private final ProposedFixValidator proposedFixValidator;

    public TolerantResponseParser() {
        this(ParserSettings.DEFAULTS);
    }

    public TolerantResponseParser(ParserSettings settings) {
        this(settings, SectionStrategies.DEFAULT_ORDER);
    }

    public TolerantResponseParser(ParserSettings settings, List<SectionStrategy> strategies) {
        this.settings = settings == null ? ParserSettings.DEFAULTS : settings;
        this.sections = new SectionExtractor(strategies, this.settings.minSectionLength());
        this.proposedFixValidator = new ProposedFixValidator(
                this.settings.minProposedFixLength(),
                this.settings.warningPreviewChars()
        );
    }

    public ParsedInsight parse(String rawText) {
        return parse(rawText, InsightSchema.ARCHITECTURE);
    }

    public ParsedInsight parse(String rawText, InsightSchema schema) {
        String content = rawText == null ? "" : rawText;
        InsightSchema effective = schema == null ? InsightSchema.ARCHITECTURE : schema;
        List<String> warnings = new ArrayList<>();

        Map<String, String> textSections = new LinkedHashMap<>();
        for (InsightSchema.Field field : effective.textSections()) {
            textSections.put(field.key(), sections.extractAny(content, field.headings()).orElse(""));
        }

        Map<String, List<String>> lists = new LinkedHashMap<>();
        for (InsightSchema.Field field : effective.listSections()) {
            lists.put(field.key(), extractList(content, field, warnings));
        }

        Map<String, List<StructuredItem>> structured = new LinkedHashMap<>();
        for (InsightSchema.Field field : effective.structuredSections()) {
            structured.put(field.key(), extractStructured(content, field));
        }

        ParsedInsight parsed = new ParsedInsight(textSections, lists, structured, "", content, warnings);
        if (!parsed.hasStructuredContent()) {
            Optional<String> paragraph = firstParagraph(content);
            if (paragraph.isPresent()) {
                log.warn("No sections recognised in {} chars of output, using first paragraph as summary",
                        content.length());
                parsed = new ParsedInsight(textSections, lists, structured, paragraph.get(), content, warnings);
            }
        }
        log.debug("Parsed insight: sections={}, lists={}, structured={}, warnings={}",
                textSections.keySet(), lists.keySet(), structured.keySet(), warnings.size());
        return parsed;
    }

    /**
     * Items of the first heading that yields any; an issue-style field also collects one warning
     * per item with a too-short "Proposed Fix".
     */
    public List<String> extractList(String content, InsightSchema.Field field, List<String> warnings) {
        for (String heading : field.headings()) {
            Optional<String> section = sections.extract(content, heading);
            if (section.isEmpty()) {
                continue;
            }
            List<String> items = listItems.extract(section.get());
            if (items.isEmpty()) {
                continue;
            }
            if (field.validateProposedFix()) {
                for (String item : items) {
                    proposedFixValidator.validate(item).ifPresent(warning -> {
                        log.warn(warning);
                        warnings.add(warning);
                    });
                }
            }
            return items;
        }
        return List.of();
    }

    public List<StructuredItem> extractStructured(String content, InsightSchema.Field field) {
        Optional<String> section = sections.extractAny(content, field.headings());
        if (section.isEmpty()) {
            return List.of();
        }
        List<StructuredItem> items = structuredItems.extract(section.get());
        if (!items.isEmpty()) {
            return items;
        }
        List<StructuredItem> fallback = new ArrayList<>();
        for (String item : listItems.extract(section.get())) {
            int newline = item.indexOf('\n');
            fallback.add(newline < 0
                    ? new StructuredItem(item, "")
                    : new StructuredItem(item.substring(0, newline).trim(), item.substring(newline + 1).trim()));
        }
        return fallback;
    }

    private Optional<String> firstParagraph(String content) {
        if (content.trim().length() <= settings.fallbackParagraphMinLength()) {
            return Optional.empty();
        }
        for (String paragraph : PARAGRAPH_BREAK.split(content)) {
            String trimmed = paragraph.trim();
            if (trimmed.length() > settings.fallbackParagraphMinLength()) {
                return Optional.of(trimmed);
            }
        }
        return Optional.empty();
    }
}

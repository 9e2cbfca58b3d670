package com.linlay.archinsight.parser;

import java.util.List;

/**
 * Heading conventions tried in order; the first capture that passes the length threshold wins.
 * Markdown headings only match at the start of a line, and a capture under an H<i>n</i> heading
 * runs until the next heading of level <i>n</i> or higher.
 */
public final class SectionStrategies {

    public static final SectionStrategy H2 = new HeadingPatternStrategy(
            "h2", "(?m)^##\\s+%s\\s*\\n+([\\s\\S]*?)(?=\\n#{1,2}\\s|\\z)");
    public static final SectionStrategy H1 = new HeadingPatternStrategy(
            "h1", "(?m)^#\\s+%s\\s*\\n+([\\s\\S]*?)(?=\\n#\\s|\\z)");
    public static final SectionStrategy H3 = new HeadingPatternStrategy(
            "h3", "(?m)^###\\s+%s\\s*\\n+([\\s\\S]*?)(?=\\n#{1,3}\\s|\\z)");
    public static final SectionStrategy H2_COLON = new HeadingPatternStrategy(
            "h2-colon", "(?m)^##\\s+%s\\s*:\\s*\\n+([\\s\\S]*?)(?=\\n#{1,2}\\s|\\z)");
    public static final SectionStrategy BOLD = new HeadingPatternStrategy(
            "bold", "\\*\\*%s\\*\\*\\s*:?\\s*\\n+([\\s\\S]*?)(?=\\n\\*\\*|\\n#{1,6}\\s|\\z)");
    public static final SectionStrategy NUMBERED = new HeadingPatternStrategy(
            "numbered", "\\d+\\.\\s*%s\\s*:?\\s*\\n+([\\s\\S]*?)(?=\\n\\d+\\.|\\n#{1,6}\\s|\\z)");

    public static final List<SectionStrategy> DEFAULT_ORDER = List.of(H2, H1, H3, H2_COLON, BOLD, NUMBERED);

    private SectionStrategies() {
    }
}

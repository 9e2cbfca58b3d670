package com.linlay.archinsight.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SectionStrategiesTest {

    private static final String BODY = "The codebase is split into clear layers.";

    @Test
    void eachStrategyShouldRecogniseItsHeadingStyle() {
        assertThat(SectionStrategies.H2.extract("## Organization\n" + BODY + "\n## Next\nmore", "Organization"))
                .contains(BODY);
        assertThat(SectionStrategies.H1.extract("# Organization\n" + BODY + "\n# Next\nmore", "Organization"))
                .contains(BODY);
        assertThat(SectionStrategies.H3.extract("### Organization\n" + BODY + "\n### Next", "Organization"))
                .contains(BODY);
        assertThat(SectionStrategies.H2_COLON.extract("## Organization:\n" + BODY, "Organization"))
                .contains(BODY);
        assertThat(SectionStrategies.BOLD.extract("**Organization**:\n" + BODY + "\n**Next**", "Organization"))
                .contains(BODY);
        assertThat(SectionStrategies.NUMBERED.extract("1. Organization:\n" + BODY + "\n2. Next", "Organization"))
                .contains(BODY);
    }

    @Test
    void sectionNameShouldMatchCaseInsensitively() {
        assertThat(SectionStrategies.H2.extract("## ORGANIZATION\n" + BODY, "organization")).contains(BODY);
    }

    @Test
    void specialCharactersInNameShouldBeLiteral() {
        String text = "## Issues & Concerns (v2)\n- Something is wrong here\n";

        assertThat(SectionStrategies.H2.extract(text, "Issues & Concerns (v2)"))
                .contains("- Something is wrong here");
    }

    @Test
    void extractorShouldSkipCapturesAtOrBelowMinimumLength() {
        SectionExtractor extractor = new SectionExtractor(SectionStrategies.DEFAULT_ORDER, 10);

        assertThat(extractor.extract("## Strengths\n0123456789\n", "Strengths")).isEmpty();
        assertThat(extractor.extract("## Strengths\n0123456789X\n", "Strengths")).contains("0123456789X");
    }

    @Test
    void laterStrategyShouldWinWhenEarlierOnesFail() {
        SectionExtractor extractor = new SectionExtractor(SectionStrategies.DEFAULT_ORDER, 10);
        String text = "Intro\n**Entry Points**\nmain.ts boots the server and the worker.\n";

        assertThat(extractor.extract(text, "Entry Points")).contains("main.ts boots the server and the worker.");
        assertThat(extractor.extractAny(text, List.of("Missing", "Entry Points")))
                .contains("main.ts boots the server and the worker.");
    }

    @Test
    void h2SectionShouldKeepItsSubsections() {
        String text = "## Recommendations\n### Consolidate clients\nmerge the two clients\n"
                + "### Add tests\ncover the parser\n## Priorities\nnone";

        assertThat(SectionStrategies.H2.extract(text, "Recommendations")).contains(
                "### Consolidate clients\nmerge the two clients\n### Add tests\ncover the parser");
    }

    @Test
    void h2SectionShouldStopAtFollowingH1() {
        String text = "## Strengths\n- Clear layering between modules\n# Appendix\nunrelated appendix text";

        assertThat(SectionStrategies.H2.extract(text, "Strengths")).contains("- Clear layering between modules");
    }

    @Test
    void h1SectionShouldSpanLowerLevelHeadings() {
        String text = "# Organization\nintro\n## Layers\nthree of them\n# Next\nmore";

        assertThat(SectionStrategies.H1.extract(text, "Organization")).contains("intro\n## Layers\nthree of them");
    }

    @Test
    void headingsShouldOnlyMatchAtLineStart() {
        assertThat(SectionStrategies.H2.extract("### Strengths\n" + BODY, "Strengths")).isEmpty();
        assertThat(SectionStrategies.H1.extract("## Strengths\n" + BODY, "Strengths")).isEmpty();
        assertThat(SectionStrategies.H3.extract("### Strengths\n" + BODY, "Strengths")).contains(BODY);
    }
}

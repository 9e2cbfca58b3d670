package com.linlay.archinsight.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ListItemExtractorTest {

    private final ListItemExtractor extractor = new ListItemExtractor();

    @ParameterizedTest
    @ValueSource(strings = {"- %s", "* %s", "• %s", "%d. %s", "%d) %s"})
    void markerStyleShouldNotChangeItemCount(String format) {
        StringBuilder section = new StringBuilder();
        String[] texts = {"Layered services", "Thin controllers", "Shared DTO module"};
        for (int i = 0; i < texts.length; i++) {
            String line = format.contains("%d") ? String.format(format, i + 1, texts[i]) : String.format(format, texts[i]);
            section.append(line).append('\n');
        }

        assertThat(extractor.extract(section.toString())).containsExactly(texts);
    }

    @Test
    void continuationLinesShouldJoinCurrentItem() {
        String section = """
                - Circular import between core and ui
                  Proposed Fix: move shared types into a common module

                - Missing tests
                """;

        assertThat(extractor.extract(section)).containsExactly(
                "Circular import between core and ui\nProposed Fix: move shared types into a common module",
                "Missing tests"
        );
    }

    @Test
    void textBeforeFirstMarkerAndEmptyItemsShouldBeDropped() {
        String section = "Intro sentence without marker\n-   \n- Real item\n";

        assertThat(extractor.extract(section)).containsExactly("Real item");
    }

    @Test
    void markerNeedsTrailingWhitespace() {
        assertThat(ListItemExtractor.startsItem("-dash")).isFalse();
        assertThat(ListItemExtractor.startsItem("10. tenth")).isTrue();
        assertThat(ListItemExtractor.startsItem("**bold**")).isFalse();
        assertThat(extractor.extract(null)).isEmpty();
    }
}

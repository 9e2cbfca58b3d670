package com.linlay.archinsight.parser;

import java.util.Optional;

/**
 * One heading convention. Returns the raw capture under the named heading, if this convention
 * finds one; acceptance thresholds are applied by {@link SectionExtractor}.
 */
@FunctionalInterface
public interface SectionStrategy {

    Optional<String> extract(String text, String sectionName);
}

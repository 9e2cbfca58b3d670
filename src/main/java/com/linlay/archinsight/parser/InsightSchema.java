package com.linlay.archinsight.parser;

import java.util.List;

/**
 * Which sections a reply is expected to contain and under which heading names each may appear.
 * The first alias is the canonical key in {@link ParsedInsight}.
 */
public record InsightSchema(
        List<Field> textSections,
        List<Field> listSections,
        List<Field> structuredSections
) {

    public static final InsightSchema ARCHITECTURE = new InsightSchema(
            List.of(
                    Field.of("Overall Assessment",
                            "Overall Architecture Assessment", "Architecture Assessment", "Overall Assessment", "Overall"),
                    Field.of("Organization", "Code Organization", "Organization", "File Organization"),
                    Field.of("Entry Points", "Entry Points", "Entry Points Analysis"),
                    Field.of("Orphaned Files", "Orphaned Files", "Orphaned Files Analysis"),
                    Field.of("Folder Reorganization",
                            "Folder Reorganization", "Reorganization", "Folder Reorganization Plan")
            ),
            List.of(
                    Field.of("Strengths", "Strengths"),
                    Field.validated("Issues", "Issues & Concerns", "Issues", "Concerns")
            ),
            List.of(
                    Field.of("Recommendations", "Recommendations"),
                    Field.of("Priorities", "Refactoring Priorities", "Priorities", "Refactoring")
            )
    );

    public static final InsightSchema PRODUCT_PURPOSE = new InsightSchema(
            List.of(
                    Field.of("Product Purpose", "Product Purpose"),
                    Field.of("Architecture Rationale", "Architecture Rationale")
            ),
            List.of(
                    Field.of("Key Design Decisions", "Key Design Decisions"),
                    Field.of("User Goals", "User Goals"),
                    Field.of("Contextual Factors", "Contextual Factors")
            ),
            List.of()
    );

    public static final InsightSchema FILE_SUMMARY = new InsightSchema(
            List.of(
                    Field.of("Purpose", "Purpose"),
                    Field.of("Intent", "Intent")
            ),
            List.of(
                    Field.of("User Visible Actions", "User Visible Actions", "User-Visible Actions", "userVisibleActions"),
                    Field.of("Developer Visible Actions",
                            "Developer Visible Actions", "Developer-Visible Actions", "developerVisibleActions"),
                    Field.of("Dependencies", "Dependencies")
            ),
            List.of()
    );

    public static final InsightSchema MODULE_SUMMARY = new InsightSchema(
            List.of(Field.of("Summary", "Summary")),
            List.of(Field.of("Capabilities", "Capabilities")),
            List.of()
    );

    public static final InsightSchema PRODUCT_DOCS = new InsightSchema(
            List.of(
                    Field.of("Overview", "Product Overview", "Overview"),
                    Field.of("Architecture", "Architecture", "Architecture Overview")
            ),
            List.of(
                    Field.of("Features", "Key Features", "Features"),
                    Field.of("Tech Stack", "Tech Stack", "Technology Stack"),
                    Field.of("API Endpoints", "API Endpoints"),
                    Field.of("Data Models", "Data Models"),
                    Field.of("User Flows", "User Flows")
            ),
            List.of()
    );

    public InsightSchema {
        textSections = textSections == null ? List.of() : List.copyOf(textSections);
        listSections = listSections == null ? List.of() : List.copyOf(listSections);
        structuredSections = structuredSections == null ? List.of() : List.copyOf(structuredSections);
    }

    /**
     * @param key                 name under which the result is published
     * @param headings            heading names tried in order
     * @param validateProposedFix whether list items are checked for an empty "Proposed Fix"
     */
    public record Field(String key, List<String> headings, boolean validateProposedFix) {

        public Field {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
            headings = headings == null || headings.isEmpty() ? List.of(key) : List.copyOf(headings);
        }

        public static Field of(String key, String... headings) {
            return new Field(key, List.of(headings), false);
        }

        public static Field validated(String key, String... headings) {
            return new Field(key, List.of(headings), true);
        }
    }
}

package com.linlay.archinsight.insight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.archinsight.parser.StructuredItem;
import com.linlay.archinsight.parser.TolerantResponseParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InsightAssemblerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InsightAssembler assembler = new InsightAssembler(objectMapper, new TolerantResponseParser());

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) objectMapper.readTree(text);
    }

    @Test
    void jsonFieldsShouldMapDirectlyAndAcceptMixedItemShapes() throws Exception {
        ObjectNode result = json("""
                {
                  "overallAssessment": "Layered and readable.",
                  "strengths": ["Small modules", {"title": "Typed API", "description": "All handlers are typed"}],
                  "issues": [{"title": "Cycle", "description": ""}, "  "],
                  "recommendations": [
                    "Add lint rules",
                    {"title": "Split ui", "description": "ui mixes state and views", "relevantFiles": ["src/ui.ts"], "extra": 1}
                  ],
                  "priorities": null
                }
                """);

        ArchitectureInsights insights = assembler.toArchitectureInsights(result);

        assertThat(insights.overallAssessment()).isEqualTo("Layered and readable.");
        assertThat(insights.strengths()).containsExactly("Small modules", "Typed API: All handlers are typed");
        assertThat(insights.issues()).containsExactly("Cycle");
        assertThat(insights.recommendations()).containsExactly(
                new StructuredItem("Add lint rules", ""),
                new StructuredItem("Split ui", "ui mixes state and views", List.of("src/ui.ts"), List.of())
        );
        assertThat(insights.priorities()).isEmpty();
        assertThat(insights.organization()).isEmpty();
        assertThat(insights.rawContent()).contains("\"overallAssessment\"");
    }

    @Test
    void rawContentOnlyResultShouldGoThroughTextParser() throws Exception {
        ObjectNode result = objectMapper.createObjectNode();
        result.put(InsightAssembler.RAW_CONTENT_FIELD, """
                ## Strengths
                - Clear folder per feature
                - Entry point is obvious

                ## Issues
                - Utility module is a dumping ground
                  Proposed Fix: n/a
                """);

        ArchitectureInsights insights = assembler.toArchitectureInsights(result);

        assertThat(insights.strengths()).containsExactly("Clear folder per feature", "Entry point is obvious");
        assertThat(insights.issues()).hasSize(1);
        assertThat(insights.warnings()).hasSize(1);
        assertThat(insights.rawContent()).startsWith("## Strengths");
    }

    @Test
    void unstructuredReplyShouldFillOverallAssessmentFromFallback() throws Exception {
        String paragraph = "The repository is a single package with no obvious layering between IO and logic.";
        ObjectNode result = json("{\"rawContent\": \"" + paragraph + "\"}");

        ArchitectureInsights insights = assembler.toArchitectureInsights(result);

        assertThat(insights.overallAssessment()).isEqualTo(paragraph);
        assertThat(insights.strengths()).isEmpty();
    }

    @Test
    void productPurposeShouldReadJsonOrProse() throws Exception {
        ProductPurposeAnalysis fromJson = assembler.toProductPurpose(json("""
                {"productPurpose": "Visualise code structure", "userGoals": ["Onboard faster"], "designDecisions": []}
                """));
        ObjectNode prose = objectMapper.createObjectNode();
        prose.put(InsightAssembler.RAW_CONTENT_FIELD, """
                ## Product Purpose
                Visualise code structure for new contributors.

                ## Contextual Factors
                - Runs inside an editor extension
                """);
        ProductPurposeAnalysis fromText = assembler.toProductPurpose(prose);

        assertThat(fromJson.productPurpose()).isEqualTo("Visualise code structure");
        assertThat(fromJson.userGoals()).containsExactly("Onboard faster");
        assertThat(fromJson.architectureRationale()).isEmpty();
        assertThat(fromText.productPurpose()).isEqualTo("Visualise code structure for new contributors.");
        assertThat(fromText.contextualFactors()).containsExactly("Runs inside an editor extension");
    }
}

package com.linlay.archinsight.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.archinsight.parser.InsightSchema;
import com.linlay.archinsight.parser.ParsedInsight;
import com.linlay.archinsight.parser.StructuredItem;
import com.linlay.archinsight.parser.TolerantResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps the final loop result onto the typed insight records. A result carrying any of the known
 * JSON fields is read field by field; anything else is treated as prose and handed to the
 * {@link TolerantResponseParser}.
 */
public class InsightAssembler {

    private static final Logger log = LoggerFactory.getLogger(InsightAssembler.class);

    public static final String RAW_CONTENT_FIELD = "rawContent";

    private static final Set<String> ARCHITECTURE_FIELDS = Set.of(
            "overallAssessment", "strengths", "issues", "organization", "entryPointsAnalysis",
            "orphanedFilesAnalysis", "folderReorganization", "recommendations", "priorities"
    );
    private static final Set<String> PRODUCT_PURPOSE_FIELDS = Set.of(
            "productPurpose", "architectureRationale", "designDecisions", "userGoals", "contextualFactors"
    );

    private final ObjectMapper objectMapper;
    private final TolerantResponseParser parser;

    public InsightAssembler(ObjectMapper objectMapper, TolerantResponseParser parser) {
        this.objectMapper = objectMapper;
        this.parser = parser;
    }

    public ArchitectureInsights toArchitectureInsights(ObjectNode result) {
        if (!JsonFields.hasAny(result, ARCHITECTURE_FIELDS)) {
            return fromParsed(parser.parse(rawContent(result), InsightSchema.ARCHITECTURE));
        }
        return new ArchitectureInsights(
                JsonFields.text(result, "overallAssessment"),
                JsonFields.strings(result.get("strengths")),
                JsonFields.strings(result.get("issues")),
                JsonFields.text(result, "organization"),
                JsonFields.text(result, "entryPointsAnalysis"),
                JsonFields.text(result, "orphanedFilesAnalysis"),
                JsonFields.text(result, "folderReorganization"),
                items(result.get("recommendations")),
                items(result.get("priorities")),
                rawContent(result),
                List.of(),
                null
        );
    }

    public ArchitectureInsights fromParsed(ParsedInsight parsed) {
        String overall = parsed.section("Overall Assessment");
        if (!StringUtils.hasText(overall)) {
            overall = parsed.fallbackSummary();
        }
        return new ArchitectureInsights(
                overall,
                parsed.list("Strengths"),
                parsed.list("Issues"),
                parsed.section("Organization"),
                parsed.section("Entry Points"),
                parsed.section("Orphaned Files"),
                parsed.section("Folder Reorganization"),
                parsed.items("Recommendations"),
                parsed.items("Priorities"),
                parsed.rawContent(),
                parsed.warnings(),
                null
        );
    }

    public ProductPurposeAnalysis toProductPurpose(ObjectNode result) {
        if (!JsonFields.hasAny(result, PRODUCT_PURPOSE_FIELDS)) {
            ParsedInsight parsed = parser.parse(rawContent(result), InsightSchema.PRODUCT_PURPOSE);
            String purpose = parsed.section("Product Purpose");
            return new ProductPurposeAnalysis(
                    StringUtils.hasText(purpose) ? purpose : parsed.fallbackSummary(),
                    parsed.section("Architecture Rationale"),
                    parsed.list("Key Design Decisions"),
                    parsed.list("User Goals"),
                    parsed.list("Contextual Factors")
            );
        }
        return new ProductPurposeAnalysis(
                JsonFields.text(result, "productPurpose"),
                JsonFields.text(result, "architectureRationale"),
                JsonFields.strings(result.get("designDecisions")),
                JsonFields.strings(result.get("userGoals")),
                JsonFields.strings(result.get("contextualFactors"))
        );
    }

    private String rawContent(ObjectNode result) {
        JsonNode raw = result.get(RAW_CONTENT_FIELD);
        if (raw != null && raw.isTextual()) {
            return raw.asText();
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize generation result", ex);
        }
    }

    private List<StructuredItem> items(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<StructuredItem> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isTextual()) {
                if (StringUtils.hasText(element.asText())) {
                    values.add(new StructuredItem(element.asText().trim(), ""));
                }
            } else if (element.isObject()) {
                try {
                    values.add(objectMapper.treeToValue(element, StructuredItem.class));
                } catch (JsonProcessingException ex) {
                    log.warn("Keeping unreadable item as text {}: {}", element, ex.getOriginalMessage());
                    values.add(new StructuredItem(element.toString(), ""));
                }
            }
        }
        return values;
    }
}

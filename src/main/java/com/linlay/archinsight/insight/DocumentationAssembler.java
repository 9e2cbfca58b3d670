package com.linlay.archinsight.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.archinsight.parser.InsightSchema;
import com.linlay.archinsight.parser.ListItemExtractor;
import com.linlay.archinsight.parser.LlmJsonExtractor;
import com.linlay.archinsight.parser.ParsedInsight;
import com.linlay.archinsight.parser.TolerantResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps documentation replies (file summaries, module rollups and product docs) onto their records.
 * A reply carrying a JSON object with any known field is read field by field; otherwise the
 * {@link TolerantResponseParser} recovers what it can from the prose.
 */
public class DocumentationAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentationAssembler.class);

    public static final String UNKNOWN_PURPOSE = "Could not extract purpose";

    private static final Set<String> FILE_FIELDS = Set.of(
            "purpose", "userVisibleActions", "developerVisibleActions", "keyFunctions", "dependencies", "intent"
    );
    private static final Set<String> MODULE_FIELDS = Set.of(
            "capabilities", "summary", "endpoints", "commands", "workers"
    );
    private static final Set<String> PRODUCT_FIELDS = Set.of(
            "overview", "features", "architecture", "techStack", "apiEndpoints", "dataModels", "userFlows"
    );

    private static final int MIN_OVERVIEW_LENGTH = 20;
    private static final Pattern LEADING_TEXT = Pattern.compile("^([\\s\\S]*?)(?=\\n#|\\z)");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\r?\\n\\s*\\r?\\n");
    // "Features:" on a line of its own, followed by bullets.
    private static final Pattern PLAIN_FEATURES = Pattern.compile(
            "^(?:Key Features|Features)\\s*:?[ \\t]*\\n((?:[ \\t]*(?:[-•*]|\\d+[.)])\\s+.+(?:\\n|\\z))+)",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE
    );

    private final ObjectMapper objectMapper;
    private final TolerantResponseParser parser;
    private final LlmJsonExtractor jsonExtractor;

    public DocumentationAssembler(ObjectMapper objectMapper, TolerantResponseParser parser, LlmJsonExtractor jsonExtractor) {
        this.objectMapper = objectMapper;
        this.parser = parser;
        this.jsonExtractor = jsonExtractor;
    }

    public FileSummary toFileSummary(String content, String file, String role) {
        String text = content == null ? "" : content;
        Optional<ObjectNode> json = jsonWith(text, FILE_FIELDS);
        if (json.isPresent()) {
            ObjectNode node = json.get();
            return new FileSummary(
                    file,
                    role,
                    JsonFields.text(node, "purpose"),
                    JsonFields.strings(node.get("userVisibleActions")),
                    JsonFields.strings(node.get("developerVisibleActions")),
                    JsonFields.objects(objectMapper, node.get("keyFunctions"), KeyFunction.class),
                    JsonFields.strings(node.get("dependencies")),
                    JsonFields.text(node, "intent"),
                    text
            );
        }
        log.debug("File summary for {} carries no JSON, parsing prose", file);
        ParsedInsight parsed = parser.parse(text, InsightSchema.FILE_SUMMARY);
        String purpose = parsed.section("Purpose");
        return new FileSummary(
                file,
                role,
                StringUtils.hasText(purpose) ? purpose : UNKNOWN_PURPOSE,
                parsed.list("User Visible Actions"),
                parsed.list("Developer Visible Actions"),
                List.of(),
                parsed.list("Dependencies"),
                parsed.section("Intent"),
                text
        );
    }

    public ModuleSummary toModuleSummary(String content, String module, String moduleType, List<FileSummary> files) {
        String text = content == null ? "" : content;
        Optional<ObjectNode> json = jsonWith(text, MODULE_FIELDS);
        if (json.isPresent()) {
            ObjectNode node = json.get();
            return new ModuleSummary(
                    module,
                    moduleType,
                    JsonFields.strings(node.get("capabilities")),
                    JsonFields.text(node, "summary"),
                    files,
                    JsonFields.objects(objectMapper, node.get("endpoints"), ModuleSummary.Endpoint.class),
                    JsonFields.objects(objectMapper, node.get("commands"), ModuleSummary.Command.class),
                    JsonFields.objects(objectMapper, node.get("workers"), ModuleSummary.Worker.class)
            );
        }
        ParsedInsight parsed = parser.parse(text, InsightSchema.MODULE_SUMMARY);
        return new ModuleSummary(
                module,
                moduleType,
                parsed.list("Capabilities"),
                parsed.section("Summary"),
                files,
                null,
                null,
                null
        );
    }

    public ProductDocumentation toProductDocumentation(String content) {
        String text = content == null ? "" : content;
        Optional<ObjectNode> json = jsonWith(text, PRODUCT_FIELDS);
        return json.isPresent() ? fromJson(json.get(), text) : fromProse(text);
    }

    /**
     * Maps the final result of the documentation loop.
     */
    public ProductDocumentation toProductDocumentation(ObjectNode result) {
        if (JsonFields.hasAny(result, PRODUCT_FIELDS)) {
            return fromJson(result, serialize(result));
        }
        JsonNode raw = result.get(InsightAssembler.RAW_CONTENT_FIELD);
        return fromProse(raw != null && raw.isTextual() ? raw.asText() : serialize(result));
    }

    private ProductDocumentation fromJson(ObjectNode node, String rawContent) {
        return new ProductDocumentation(
                JsonFields.text(node, "overview"),
                JsonFields.strings(node.get("features")),
                JsonFields.text(node, "architecture"),
                JsonFields.strings(node.get("techStack")),
                JsonFields.strings(node.get("apiEndpoints")),
                JsonFields.strings(node.get("dataModels")),
                JsonFields.strings(node.get("userFlows")),
                rawContent
        );
    }

    private ProductDocumentation fromProse(String text) {
        ParsedInsight parsed = parser.parse(text, InsightSchema.PRODUCT_DOCS);
        String overview = parsed.section("Overview");
        if (!StringUtils.hasText(overview)) {
            overview = leadingOverview(text);
        }
        List<String> features = parsed.list("Features");
        if (features.isEmpty()) {
            features = plainFeatures(text);
        }
        ProductDocumentation docs = new ProductDocumentation(
                overview,
                features,
                parsed.section("Architecture"),
                parsed.list("Tech Stack"),
                parsed.list("API Endpoints"),
                parsed.list("Data Models"),
                parsed.list("User Flows"),
                text
        );
        log.debug("Parsed product docs: overview={}, features={}, techStack={}",
                !docs.overview().isEmpty(), docs.features().size(), docs.techStack().size());
        return docs;
    }

    // Text ahead of the first heading, else the first paragraph.
    private static String leadingOverview(String text) {
        Matcher leading = LEADING_TEXT.matcher(text);
        if (!text.stripLeading().startsWith("#")
                && leading.find()
                && leading.group(1).trim().length() > MIN_OVERVIEW_LENGTH) {
            return leading.group(1).trim();
        }
        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String trimmed = paragraph.trim();
            if (trimmed.length() > MIN_OVERVIEW_LENGTH && !trimmed.startsWith("#")) {
                return trimmed;
            }
        }
        return "";
    }

    private static List<String> plainFeatures(String text) {
        Matcher matcher = PLAIN_FEATURES.matcher(text);
        return matcher.find() ? new ListItemExtractor().extract(matcher.group(1)) : List.of();
    }

    private Optional<ObjectNode> jsonWith(String text, Set<String> fields) {
        return jsonExtractor.extractObject(text).filter(node -> JsonFields.hasAny(node, fields));
    }

    private String serialize(ObjectNode result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize generation result", ex);
        }
    }
}

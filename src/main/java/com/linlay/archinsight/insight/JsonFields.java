package com.linlay.archinsight.insight;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lenient readers for the fields of a generated JSON reply. Missing or null values read as empty.
 */
final class JsonFields {

    private static final Logger log = LoggerFactory.getLogger(JsonFields.class);

    private JsonFields() {
    }

    static boolean hasAny(ObjectNode result, Set<String> fields) {
        for (String field : fields) {
            if (result.hasNonNull(field)) {
                return true;
            }
        }
        return false;
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    // Items arrive either as plain strings or as {title, description, ...} objects.
    static List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isTextual()) {
                addIfPresent(values, element.asText());
            } else if (element.isObject()) {
                String title = text(element, "title");
                String description = text(element, "description");
                if (StringUtils.hasText(title) && StringUtils.hasText(description)) {
                    values.add(title.trim() + ": " + description.trim());
                } else {
                    addIfPresent(values, StringUtils.hasText(title) ? title : description);
                }
            } else if (!element.isNull()) {
                values.add(element.asText());
            }
        }
        return values;
    }

    /**
     * Binds each object element to {@code type}; elements that do not bind are skipped with a warning.
     */
    static <T> List<T> objects(ObjectMapper objectMapper, JsonNode node, Class<T> type) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<T> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isObject()) {
                continue;
            }
            try {
                values.add(objectMapper.treeToValue(element, type));
            } catch (JsonProcessingException ex) {
                log.warn("Skipping unreadable {} {}: {}", type.getSimpleName(), element, ex.getOriginalMessage());
            }
        }
        return values;
    }

    private static void addIfPresent(List<String> values, String value) {
        if (StringUtils.hasText(value)) {
            values.add(value.trim());
        }
    }
}

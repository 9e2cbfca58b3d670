package com.linlay.archinsight.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a JSON object in model output that may wrap it in prose or markdown fences.
 * <p>
 * Tried in order: the whole text, the first fenced block, then every balanced {@code {...}} span.
 * Parsing tolerates trailing commas, comments, single quotes and unquoted field names.
 */
public class LlmJsonExtractor {

    private static final Pattern FENCED_OBJECT = Pattern.compile("```(?:json)?\\s*(\\{[\\s\\S]*?\\})\\s*```");
    private static final int MAX_CANDIDATES = 32;

    static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Optional<ObjectNode> extractObject(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        String trimmed = content.trim();
        if (trimmed.startsWith("{")) {
            Optional<ObjectNode> whole = tryParse(trimmed);
            if (whole.isPresent()) {
                return whole;
            }
        }

        Matcher fenced = FENCED_OBJECT.matcher(content);
        if (fenced.find()) {
            Optional<ObjectNode> block = tryParse(fenced.group(1));
            if (block.isPresent()) {
                return block;
            }
            Optional<ObjectNode> inner = scanBalanced(fenced.group(1));
            if (inner.isPresent()) {
                return inner;
            }
        }
        return scanBalanced(content);
    }

    private Optional<ObjectNode> scanBalanced(String text) {
        int from = 0;
        for (int candidate = 0; candidate < MAX_CANDIDATES; candidate++) {
            int start = text.indexOf('{', from);
            if (start < 0) {
                return Optional.empty();
            }
            int end = matchingBrace(text, start);
            if (end > start) {
                Optional<ObjectNode> parsed = tryParse(text.substring(start, end + 1));
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
            from = start + 1;
        }
        return Optional.empty();
    }

    private int matchingBrace(String text, int start) {
        int depth = 0;
        boolean escaped = false;
        char quote = 0;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (ch == '\\') {
                escaped = true;
                continue;
            }
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<ObjectNode> tryParse(String candidate) {
        try {
            JsonNode node = LENIENT_MAPPER.readTree(candidate);
            return node instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }
}

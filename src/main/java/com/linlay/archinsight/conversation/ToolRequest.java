package com.linlay.archinsight.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.springframework.util.StringUtils;

/**
 * A request for more context embedded in a generation reply, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ToolRequest.FileRequest.class, name = "file"),
        @JsonSubTypes.Type(value = ToolRequest.GrepRequest.class, name = "grep")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface ToolRequest permits ToolRequest.FileRequest, ToolRequest.GrepRequest {

    int DEFAULT_GREP_RESULTS = 20;

    String reason();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileRequest(String path, String reason) implements ToolRequest {

        public FileRequest {
            if (!StringUtils.hasText(path)) {
                throw new IllegalArgumentException("file request requires a path");
            }
            path = path.trim();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GrepRequest(String pattern, String filePattern, Integer maxResults, String reason) implements ToolRequest {

        public GrepRequest {
            if (!StringUtils.hasText(pattern)) {
                throw new IllegalArgumentException("grep request requires a pattern");
            }
            if (maxResults != null && maxResults <= 0) {
                maxResults = null;
            }
        }

        public int effectiveMaxResults() {
            return effectiveMaxResults(DEFAULT_GREP_RESULTS);
        }

        public int effectiveMaxResults(int fallback) {
            return maxResults == null ? fallback : maxResults;
        }
    }
}

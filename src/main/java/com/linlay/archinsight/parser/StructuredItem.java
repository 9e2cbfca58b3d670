package com.linlay.archinsight.parser;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StructuredItem(
        String title,
        String description,
        List<String> relevantFiles,
        List<String> relevantFunctions
) {

    public StructuredItem {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        relevantFiles = relevantFiles == null ? List.of() : List.copyOf(relevantFiles);
        relevantFunctions = relevantFunctions == null ? List.of() : List.copyOf(relevantFunctions);
    }

    public StructuredItem(String title, String description) {
        this(title, description, List.of(), List.of());
    }
}

package com.linlay.archinsight.insight;

import java.util.List;

public record ProductDocumentation(
        String overview,
        List<String> features,
        String architecture,
        List<String> techStack,
        List<String> apiEndpoints,
        List<String> dataModels,
        List<String> userFlows,
        String rawContent
) {

    public ProductDocumentation {
        overview = overview == null ? "" : overview;
        features = features == null ? List.of() : List.copyOf(features);
        architecture = architecture == null ? "" : architecture;
        techStack = techStack == null ? List.of() : List.copyOf(techStack);
        apiEndpoints = apiEndpoints == null ? List.of() : List.copyOf(apiEndpoints);
        dataModels = dataModels == null ? List.of() : List.copyOf(dataModels);
        userFlows = userFlows == null ? List.of() : List.copyOf(userFlows);
        rawContent = rawContent == null ? "" : rawContent;
    }
}

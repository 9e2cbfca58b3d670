package com.linlay.archinsight.insight;

import java.util.List;

public record ProductPurposeAnalysis(
        String productPurpose,
        String architectureRationale,
        List<String> designDecisions,
        List<String> userGoals,
        List<String> contextualFactors
) {

    public ProductPurposeAnalysis {
        productPurpose = productPurpose == null ? "" : productPurpose;
        architectureRationale = architectureRationale == null ? "" : architectureRationale;
        designDecisions = designDecisions == null ? List.of() : List.copyOf(designDecisions);
        userGoals = userGoals == null ? List.of() : List.copyOf(userGoals);
        contextualFactors = contextualFactors == null ? List.of() : List.copyOf(contextualFactors);
    }
}

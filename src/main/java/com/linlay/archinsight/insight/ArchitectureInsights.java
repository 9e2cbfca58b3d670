package com.linlay.archinsight.insight;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.linlay.archinsight.parser.StructuredItem;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ArchitectureInsights(
        String overallAssessment,
        List<String> strengths,
        List<String> issues,
        String organization,
        String entryPointsAnalysis,
        String orphanedFilesAnalysis,
        String folderReorganization,
        List<StructuredItem> recommendations,
        List<StructuredItem> priorities,
        String rawContent,
        List<String> warnings,
        ProductPurposeAnalysis productPurposeAnalysis
) {

    public ArchitectureInsights {
        overallAssessment = nullToEmpty(overallAssessment);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        issues = issues == null ? List.of() : List.copyOf(issues);
        organization = nullToEmpty(organization);
        entryPointsAnalysis = nullToEmpty(entryPointsAnalysis);
        orphanedFilesAnalysis = nullToEmpty(orphanedFilesAnalysis);
        folderReorganization = nullToEmpty(folderReorganization);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        priorities = priorities == null ? List.of() : List.copyOf(priorities);
        rawContent = nullToEmpty(rawContent);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public ArchitectureInsights withProductPurpose(ProductPurposeAnalysis analysis) {
        return new ArchitectureInsights(
                overallAssessment, strengths, issues, organization, entryPointsAnalysis,
                orphanedFilesAnalysis, folderReorganization, recommendations, priorities,
                rawContent, warnings, analysis
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

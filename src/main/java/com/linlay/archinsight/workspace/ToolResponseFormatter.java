package com.linlay.archinsight.workspace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders file and search responses as the markdown block handed back to the model.
 */
public class ToolResponseFormatter {

    public static final String HEADER = "\n## Additional Information Requested\n\n";
    private static final String TRUNCATED = "\n\n[... content truncated ...]";

    private final int maxFileChars;

    public ToolResponseFormatter(int maxFileChars) {
        this.maxFileChars = maxFileChars > 0 ? maxFileChars : 5000;
    }

    public String format(List<FileResponse> files, List<GrepResponse> searches) {
        return HEADER + formatFileResponses(files) + formatGrepResponses(searches);
    }

    public String formatFileResponses(List<FileResponse> responses) {
        if (responses == null || responses.isEmpty()) {
            return "";
        }
        StringBuilder formatted = new StringBuilder("\n## Requested Files\n\n");
        for (FileResponse response : responses) {
            if (!response.exists()) {
                formatted.append("### ").append(response.path()).append(" (not found)\n")
                        .append("File not found or cannot be read.\n\n");
                continue;
            }
            String content = response.content();
            if (content.length() > maxFileChars) {
                content = content.substring(0, maxFileChars) + TRUNCATED;
            }
            formatted.append("### ").append(response.path())
                    .append(" (").append(response.lines()).append(" lines)\n\n")
                    .append("```\n").append(content).append("\n```\n\n");
        }
        return formatted.toString();
    }

    public String formatGrepResponses(List<GrepResponse> responses) {
        if (responses == null || responses.isEmpty()) {
            return "";
        }
        StringBuilder formatted = new StringBuilder("\n## Grep Search Results\n\n");
        for (GrepResponse response : responses) {
            formatted.append("### Pattern: `").append(response.pattern()).append("`\n")
                    .append("Found ").append(response.totalMatches()).append(" match(es)");
            if (response.limited()) {
                formatted.append(" (limited to the first ").append(response.matches().size()).append(')');
            }
            formatted.append("\n\n");

            if (response.matches().isEmpty()) {
                formatted.append("No matches found.\n\n");
                continue;
            }

            Map<String, List<GrepMatch>> byFile = new LinkedHashMap<>();
            for (GrepMatch match : response.matches()) {
                byFile.computeIfAbsent(match.file(), ignored -> new ArrayList<>()).add(match);
            }
            byFile.forEach((file, matches) -> {
                formatted.append("#### ").append(file).append("\n\n");
                for (GrepMatch match : matches) {
                    formatted.append("**Line ").append(match.line()).append(":**\n");
                    appendBlock(formatted, match.before());
                    appendBlock(formatted, List.of(match.content()));
                    appendBlock(formatted, match.after());
                    formatted.append('\n');
                }
            });
            formatted.append('\n');
        }
        return formatted.toString();
    }

    private void appendBlock(StringBuilder target, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        target.append("```\n");
        for (String line : lines) {
            target.append(line).append('\n');
        }
        target.append("```\n");
    }
}

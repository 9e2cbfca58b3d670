package com.linlay.archinsight.insight;

import java.util.List;

/**
 * What one source file does for users and for developers.
 *
 * @param role   classification supplied by the caller, for example "CLI entrypoint" or "Utility"
 * @param intent why the file exists
 */
public record FileSummary(
        String file,
        String role,
        String purpose,
        List<String> userVisibleActions,
        List<String> developerVisibleActions,
        List<KeyFunction> keyFunctions,
        List<String> dependencies,
        String intent,
        String rawContent
) {

    public FileSummary {
        file = file == null ? "" : file;
        role = role == null ? "" : role;
        purpose = purpose == null ? "" : purpose;
        userVisibleActions = userVisibleActions == null ? List.of() : List.copyOf(userVisibleActions);
        developerVisibleActions = developerVisibleActions == null ? List.of() : List.copyOf(developerVisibleActions);
        keyFunctions = keyFunctions == null ? List.of() : List.copyOf(keyFunctions);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        intent = intent == null ? "" : intent;
        rawContent = rawContent == null ? "" : rawContent;
    }
}

package com.linlay.archinsight.workspace;

import java.util.List;

/**
 * @param limited true when the match cap stopped the search before every match was collected
 */
public record GrepResponse(String pattern, List<GrepMatch> matches, int totalMatches, boolean limited) {

    public GrepResponse {
        matches = matches == null ? List.of() : List.copyOf(matches);
    }

    public static GrepResponse empty(String pattern) {
        return new GrepResponse(pattern, List.of(), 0, false);
    }
}

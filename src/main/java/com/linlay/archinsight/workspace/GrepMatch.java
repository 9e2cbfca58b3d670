package com.linlay.archinsight.workspace;

import java.util.List;

public record GrepMatch(String file, int line, String content, List<String> before, List<String> after) {

    public GrepMatch {
        before = before == null ? List.of() : List.copyOf(before);
        after = after == null ? List.of() : List.copyOf(after);
    }
}

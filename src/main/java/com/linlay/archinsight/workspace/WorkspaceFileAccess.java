package com.linlay.archinsight.workspace;

import java.util.List;

/**
 * File and search collaborator that serves the model's context requests.
 */
public interface WorkspaceFileAccess {

    List<FileResponse> readFiles(List<String> paths);

    /**
     * @param pattern     case-insensitive regular expression matched per line
     * @param filePattern optional glob over workspace-relative paths, {@code **} crossing directories
     * @param maxResults  cap on collected matches
     */
    GrepResponse grep(String pattern, String filePattern, int maxResults);
}

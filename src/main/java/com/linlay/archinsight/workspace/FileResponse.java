package com.linlay.archinsight.workspace;

public record FileResponse(String path, String content, int lines, boolean exists) {

    public static FileResponse missing(String path) {
        return new FileResponse(path, "", 0, false);
    }
}

package com.leakguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ScanConfig {
    public static final long DEFAULT_MAX_FILE_SIZE = 1024L * 1024L; // 1 MiB
    public static final List<String> DEFAULT_COMMENT_MARKERS = List.of("#", "//", "/*", "*", "<!--");

    @JsonProperty("max_file_size")
    private long maxFileSize = DEFAULT_MAX_FILE_SIZE;

    @JsonProperty("comment_markers")
    private List<String> commentMarkers = new ArrayList<>(DEFAULT_COMMENT_MARKERS);

    @JsonProperty("threads")
    private int threads = 1;

    // 0 disables the per-file budget
    @JsonProperty("file_timeout_seconds")
    private long fileTimeoutSeconds = 0;

    public List<String> getCommentMarkers() {
        if (commentMarkers == null) {
            commentMarkers = new ArrayList<>(DEFAULT_COMMENT_MARKERS);
        }
        return commentMarkers;
    }
}

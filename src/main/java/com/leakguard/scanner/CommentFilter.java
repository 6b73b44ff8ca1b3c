package com.leakguard.scanner;

import java.util.List;

/**
 * Prefix test for comment-looking lines.
 *
 * <p>Not a lexer: any line whose content after leading whitespace starts with a marker is treated
 * as a comment, whatever the file's language. A Markdown bullet ({@code * item}) is therefore
 * suppressed too.</p>
 */
public class CommentFilter {
    private final List<String> markers;

    public CommentFilter(List<String> markers) {
        this.markers = List.copyOf(markers);
    }

    public boolean isComment(String line) {
        String stripped = line.stripLeading();
        for (String marker : markers) {
            if (stripped.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }
}

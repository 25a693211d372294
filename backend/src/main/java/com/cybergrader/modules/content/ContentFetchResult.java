package com.cybergrader.modules.content;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Outcome of preparing or refreshing the content root. {@code status} is one of
 * {@code local}, {@code cloned}, {@code updated}, {@code missing} or {@code error}.
 */
public record ContentFetchResult(String status,
                                 Path root,
                                 String source,
                                 String branch,
                                 Instant refreshedAt,
                                 String message) {

    public static ContentFetchResult local(Path root) {
        return new ContentFetchResult("local", root, root.toString(), null, null, null);
    }

    public boolean failed() {
        return "error".equals(status);
    }
}

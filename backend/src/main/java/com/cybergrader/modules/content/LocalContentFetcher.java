package com.cybergrader.modules.content;

import java.nio.file.Path;

public class LocalContentFetcher implements ContentFetcher {

    private final Path root;

    public LocalContentFetcher(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public ContentFetchResult prepare() {
        return ContentFetchResult.local(root);
    }

    @Override
    public ContentFetchResult refresh() {
        return ContentFetchResult.local(root);
    }
}

package com.cybergrader.modules.content;

import com.cybergrader.config.GraderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Tracks where definition files currently live and how they got there.
 * When the configured repository cannot be cloned the bundled content root
 * is used instead.
 */
@Slf4j
@Component
public class ContentWorkspace {

    private final ContentFetcher fetcher;
    private final Path bundledRoot;
    private volatile ContentFetchResult current;

    public ContentWorkspace(ContentFetcher fetcher, GraderProperties properties) {
        this.fetcher = fetcher;
        this.bundledRoot = properties.getContent().getRoot().toAbsolutePath().normalize();
        this.current = settle(fetcher.prepare());
    }

    public Path root() {
        return current.root();
    }

    public ContentFetchResult current() {
        return current;
    }

    public synchronized ContentFetchResult refresh() {
        if ("local".equals(current.status()) && current.root().equals(bundledRoot)) {
            return current;
        }
        ContentFetchResult result = fetcher.refresh();
        if (result.failed() || "missing".equals(result.status())) {
            log.warn("Content refresh {}: {}; keeping {}", result.status(), result.message(), current.root());
            current = new ContentFetchResult(result.status(), current.root(), current.source(),
                    current.branch(), current.refreshedAt(), result.message());
        } else {
            current = result;
        }
        return current;
    }

    private ContentFetchResult settle(ContentFetchResult prepared) {
        if (prepared.failed()) {
            log.warn("Falling back to bundled content at {} after repository failure: {}",
                    bundledRoot, prepared.message());
            return ContentFetchResult.local(bundledRoot);
        }
        log.info("Content root {} ({})", prepared.root(), prepared.status());
        return prepared;
    }
}

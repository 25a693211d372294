package com.cybergrader.modules.content;

/**
 * Makes definition files available on the local filesystem. Implementations
 * report problems through the returned result and never throw.
 */
public interface ContentFetcher {

    ContentFetchResult prepare();

    ContentFetchResult refresh();
}

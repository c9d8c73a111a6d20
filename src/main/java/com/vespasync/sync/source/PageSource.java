package com.vespasync.sync.source;

/**
 * Paginated read access to one source collection. Implementations must be safe to call
 * from several fetch workers at once.
 */
public interface PageSource {
    SourcePage fetchPage(String collection, SourceFilter filter, int page, int pageSize) throws FetchException;

    int defaultPageSize();
}

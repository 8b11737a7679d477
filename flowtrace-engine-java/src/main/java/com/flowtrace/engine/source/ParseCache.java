package com.flowtrace.engine.source;

import com.flowtrace.engine.ast.ParseResult;
import com.flowtrace.engine.ast.SourceAdapters;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Parse results of one run, keyed by path and content hash. A file whose content changed since
 * it was cached hashes differently and is parsed again. Nothing is shared between instances;
 * the cache lives as long as the caller keeps it.
 */
public class ParseCache {

    private final Map<String, ParseResult> results = new ConcurrentHashMap<>();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    public ParseResult parse(SourceFile file) {
        String key = file.path() + "@" + file.sha256();
        ParseResult cached = results.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        return results.computeIfAbsent(key, k -> SourceAdapters.forLanguage(file.language()).parse(file));
    }

    public int hits()   { return hits.get(); }
    public int misses() { return misses.get(); }
    public int size()   { return results.size(); }
}

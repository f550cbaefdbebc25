package com.xingest.core.cache;

import com.xingest.core.util.ScrapeClock;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 프로세스 메모리 캐시. 재시작 시 소멸. */
public final class InMemoryScrapeCache extends AbstractScrapeCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public InMemoryScrapeCache() {
        this(ScrapeClock.SYSTEM, DEFAULT_TTL);
    }

    public InMemoryScrapeCache(Duration defaultTtl) {
        this(ScrapeClock.SYSTEM, defaultTtl);
    }

    public InMemoryScrapeCache(ScrapeClock clock, Duration defaultTtl) {
        super(clock, defaultTtl);
    }

    @Override protected CacheEntry load(String key) { return entries.get(key); }
    @Override protected void store(String key, CacheEntry entry) { entries.put(key, entry); }
    @Override protected boolean remove(String key) { return entries.remove(key) != null; }
    @Override protected void removeAll() { entries.clear(); }

    @Override
    protected int sweep(long nowMillis) {
        int removed = 0;
        for (Iterator<CacheEntry> it = entries.values().iterator(); it.hasNext(); ) {
            if (!it.next().isLiveAt(nowMillis)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    protected void release() {
        entries.clear();
    }

    int size() { return entries.size(); }
}

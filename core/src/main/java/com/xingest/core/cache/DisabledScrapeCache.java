package com.xingest.core.cache;

import com.xingest.core.util.ScrapeClock;

import java.time.Duration;

/** cache.backend=NONE: 저장하지 않고 항상 미스 */
public final class DisabledScrapeCache extends AbstractScrapeCache {

    public DisabledScrapeCache() {
        super(ScrapeClock.SYSTEM, Duration.ZERO);
    }

    @Override protected CacheEntry load(String key) { return null; }
    @Override protected void store(String key, CacheEntry entry) {}
    @Override protected boolean remove(String key) { return false; }
    @Override protected void removeAll() {}
    @Override protected int sweep(long nowMillis) { return 0; }
}

package com.xingest.core.cache;

import com.xingest.core.model.ScrapeResult;
import com.xingest.core.util.ScrapeClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 공통 규칙(키 정규화, TTL, 히트 사본, close 상태)만 여기서 처리하고
 * 실제 저장은 하위 클래스의 load/store/remove 로 위임한다.
 * 모든 공개 연산은 인스턴스 모니터로 직렬화된다.
 */
public abstract class AbstractScrapeCache implements ScrapeCache {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    protected final ScrapeClock clock;
    protected final Duration defaultTtl;
    private boolean closed;

    protected AbstractScrapeCache(ScrapeClock clock, Duration defaultTtl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTtl = (defaultTtl == null ? DEFAULT_TTL : clampTtl(defaultTtl));
    }

    // ---------- 저장소 SPI ----------
    protected abstract CacheEntry load(String key);
    protected abstract void store(String key, CacheEntry entry);
    protected abstract boolean remove(String key);
    protected abstract void removeAll();
    /** now 기준 만료 항목 삭제 후 건수 */
    protected abstract int sweep(long nowMillis);
    protected void release() {}

    // ---------- ScrapeCache ----------
    @Override
    public final synchronized Optional<ScrapeResult> get(String key) {
        ensureOpen();
        String k = ScrapeCache.normalizeKey(key);
        CacheEntry e = load(k);
        if (e == null || e.result == null) return Optional.empty();

        long now = clock.nowMillis();
        if (!e.isLiveAt(now)) {
            remove(k);
            return Optional.empty();
        }
        long created = (e.createdAt == null ? now : e.createdAt.toEpochMilli());
        double ageSec = Math.max(0L, now - created) / 1000.0;
        return Optional.of(e.result.toBuilder().cached(true).cacheAgeSeconds(ageSec).build());
    }

    @Override
    public final void set(String key, ScrapeResult result) {
        set(key, result, defaultTtl);
    }

    @Override
    public final synchronized void set(String key, ScrapeResult result, Duration ttl) {
        ensureOpen();
        Objects.requireNonNull(result, "result");
        String k = ScrapeCache.normalizeKey(key);
        Duration effective = (ttl == null ? defaultTtl : clampTtl(ttl));
        Instant created = Instant.ofEpochMilli(clock.nowMillis());
        store(k, new CacheEntry(k, result, created, created.plus(effective)));
    }

    @Override
    public final synchronized boolean invalidate(String key) {
        ensureOpen();
        return remove(ScrapeCache.normalizeKey(key));
    }

    @Override
    public final synchronized void clear() {
        ensureOpen();
        removeAll();
    }

    @Override
    public final synchronized int cleanupExpired() {
        ensureOpen();
        return sweep(clock.nowMillis());
    }

    @Override
    public final synchronized void close() {
        if (closed) return;
        closed = true;
        release();
    }

    public final synchronized boolean isClosed() {
        return closed;
    }

    public Duration getDefaultTtl() { return defaultTtl; }

    protected final void ensureOpen() {
        if (closed) throw new CacheException(getClass().getSimpleName() + " is closed");
    }

    private static Duration clampTtl(Duration ttl) {
        return ttl.isNegative() ? Duration.ZERO : ttl;
    }
}

package com.xingest.core.cache;

import com.xingest.core.model.ScrapeResult;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * identity → ScrapeResult 저장소(항목별 TTL).
 * 키는 대소문자를 구분하지 않는다. close() 이후의 모든 호출은 CacheException.
 */
public interface ScrapeCache extends AutoCloseable {

    /** 없거나 만료면 empty. 히트면 cached=true, cacheAgeSeconds 가 채워진 사본. */
    Optional<ScrapeResult> get(String key);

    /** 기본 TTL 로 저장(기존 항목 교체) */
    void set(String key, ScrapeResult result);

    /** ttl 이 0 이하이면 즉시 만료되는 항목으로 저장 */
    void set(String key, ScrapeResult result, Duration ttl);

    /** @return 삭제된 항목이 있었는지 */
    boolean invalidate(String key);

    void clear();

    /** 만료 항목 정리. @return 삭제 건수 */
    int cleanupExpired();

    /** 멱등 */
    @Override
    void close();

    static String normalizeKey(String key) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("cache key must not be blank");
        return key.trim().toLowerCase(Locale.ROOT);
    }
}

package com.xingest.core.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.xingest.core.model.ScrapeResult;

import java.time.Instant;

/** 캐시 레코드 파일 포맷 (v=1) */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CacheEntry {
    public static final String VERSION = "1";

    public String v = VERSION;      // 스키마 버전
    public String key;              // 소문자 정규화된 identity
    public Instant createdAt;
    public Instant expiresAt;       // createdAt + ttl (ttl=0 이면 createdAt)
    public ScrapeResult result;

    public CacheEntry() {}

    public CacheEntry(String key, ScrapeResult result, Instant createdAt, Instant expiresAt) {
        this.key = key;
        this.result = result;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    /** expiresAt 이 now 보다 엄격히 뒤일 때만 유효 */
    public boolean isLiveAt(long nowMillis) {
        return expiresAt != null && expiresAt.toEpochMilli() > nowMillis;
    }
}

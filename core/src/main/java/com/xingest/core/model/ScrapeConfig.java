package com.xingest.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * 스크레이퍼 설정 (xingest.yml 매핑 대상). 순수 설정 보관용.
 * 시스템 프로퍼티 오버라이드는 YamlConfigLoader 쪽에서 적용한다.
 */
public final class ScrapeConfig {

    /** 캐시 백엔드 */
    public enum CacheBackend { MEMORY, FILE, NONE }

    /** 프록시 선택 전략 */
    public enum ProxyMode { ROUND_ROBIN, RANDOM, NONE }

    /** YAML `browser:` 섹션 */
    public static final class BrowserCfg {
        private boolean headless = true;
        private Duration timeout = Duration.ofSeconds(30);
        private String userAgent;   // null이면 기본 UA 풀 사용

        public boolean isHeadless() { return headless; }
        public BrowserCfg setHeadless(boolean v) { this.headless = v; return this; }

        public Duration getTimeout() { return timeout; }
        public BrowserCfg setTimeout(Duration v) { this.timeout = v; return this; }
        public BrowserCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public String getUserAgent() { return userAgent; }
        public BrowserCfg setUserAgent(String v) { this.userAgent = (v == null || v.isBlank()) ? null : v; return this; }
    }

    /** YAML `cache:` 섹션 */
    public static final class CacheCfg {
        private CacheBackend backend = CacheBackend.FILE;
        private Duration ttl = Duration.ofSeconds(300);
        private Path dir = Path.of(".xingest_cache");

        public CacheBackend getBackend() { return backend; }
        public CacheCfg setBackend(CacheBackend v) { this.backend = (v != null ? v : CacheBackend.FILE); return this; }

        public Duration getTtl() { return ttl; }
        public CacheCfg setTtl(Duration v) { this.ttl = v; return this; }
        public CacheCfg setTtlSeconds(long s) { this.ttl = Duration.ofSeconds(s); return this; }

        public Path getDir() { return dir; }
        public CacheCfg setDir(Path v) { this.dir = v; return this; }
    }

    /** YAML `proxy:` 섹션 */
    public static final class ProxyCfg {
        private ProxyMode mode = ProxyMode.NONE;
        private List<String> urls = List.of();
        private Path file;  // 한 줄에 하나, '#' 주석 허용

        public ProxyMode getMode() { return mode; }
        public ProxyCfg setMode(ProxyMode v) { this.mode = (v != null ? v : ProxyMode.NONE); return this; }

        public List<String> getUrls() { return urls; }
        public ProxyCfg setUrls(List<String> v) { this.urls = (v == null ? List.of() : List.copyOf(v)); return this; }

        public Path getFile() { return file; }
        public ProxyCfg setFile(Path v) { this.file = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String baseUrl = "https://x.com";
    private Duration requestDelay = Duration.ofMillis(1000);   // scrapeMany 항목 간 대기
    private ZoneId timeZone = ZoneId.of("UTC");               // "Mar 15" 류 날짜 해석 기준
    private Path logDir = Path.of("logs");
    private String logLevel = "INFO";

    private final BrowserCfg browser = new BrowserCfg();
    private final CacheCfg cache = new CacheCfg();
    private final ProxyCfg proxy = new ProxyCfg();

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public Duration getRequestDelay() { return requestDelay; }
    public ZoneId getTimeZone() { return timeZone; }
    public Path getLogDir() { return logDir; }
    public String getLogLevel() { return logLevel; }
    public BrowserCfg browser() { return browser; }
    public CacheCfg cache() { return cache; }
    public ProxyCfg proxy() { return proxy; }

    // ---------- fluent setters ----------
    public ScrapeConfig setBaseUrl(String baseUrl) {
        this.baseUrl = (baseUrl == null ? null : baseUrl.replaceAll("/+$", ""));
        return this;
    }
    public ScrapeConfig setRequestDelay(Duration d) { this.requestDelay = d; return this; }
    public ScrapeConfig setRequestDelayMs(long ms) { this.requestDelay = Duration.ofMillis(Math.max(0, ms)); return this; }
    public ScrapeConfig setTimeZone(ZoneId zone) { this.timeZone = (zone != null ? zone : ZoneId.of("UTC")); return this; }
    public ScrapeConfig setLogDir(Path logDir) { this.logDir = logDir; return this; }
    public ScrapeConfig setLogLevel(String level) { this.logLevel = level; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://"))
            throw new IllegalArgumentException("baseUrl must be http(s): " + baseUrl);
        if (requestDelay == null || requestDelay.isNegative())
            throw new IllegalArgumentException("requestDelay must be >= 0");

        Duration t = browser.getTimeout();
        if (t == null || t.isZero() || t.isNegative())
            throw new IllegalArgumentException("browser.timeout must be > 0");

        if (cache.getTtl() == null || cache.getTtl().isNegative())
            throw new IllegalArgumentException("cache.ttlSeconds must be >= 0");
        if (cache.getBackend() == CacheBackend.FILE) Objects.requireNonNull(cache.getDir(), "cache.dir");

        Objects.requireNonNull(proxy.getUrls(), "proxy.urls");
    }

    public static ScrapeConfig defaults() { return new ScrapeConfig(); }
}

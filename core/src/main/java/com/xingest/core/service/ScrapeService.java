package com.xingest.core.service;

import com.xingest.core.build.BuildOutcome;
import com.xingest.core.build.RecordBuilder;
import com.xingest.core.cache.ScrapeCache;
import com.xingest.core.cache.ScrapeCaches;
import com.xingest.core.extract.JsoupPageExtractor;
import com.xingest.core.extract.PageExtractor;
import com.xingest.core.fetch.FetchOptions;
import com.xingest.core.fetch.FetchResult;
import com.xingest.core.fetch.PageFetcher;
import com.xingest.core.fetch.PlaywrightPageFetcher;
import com.xingest.core.model.ExtractionOutcome;
import com.xingest.core.model.FetchFailure;
import com.xingest.core.model.ScrapeConfig;
import com.xingest.core.model.ScrapeResult;
import com.xingest.core.proxy.ProxyRotator;
import com.xingest.core.util.DefaultSleeper;
import com.xingest.core.util.ProgressListener;
import com.xingest.core.util.ScrapeClock;
import com.xingest.core.util.Sleeper;
import com.xingest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * 스크레이프 오케스트레이터:
 *  - identity 1건: 캐시 조회 → (미스) 페치 → 추출 → 레코드 변환 → 성공 시 캐시 기록
 *  - 배치: 입력 순서대로 1건씩, 항목 사이에 requestDelay 만큼 대기(마지막 뒤는 생략)
 *  - 기본 생성자는 Playwright 페처 + 설정의 캐시 백엔드, DI 생성자는 테스트/대체 구현용
 *  - 캐시 핸들은 close() 에서 한 번만 해제
 */
public final class ScrapeService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapeService.class);

    public static final String PHASE = "scrape";

    private final ScrapeConfig config;
    private final PageFetcher fetcher;
    private final PageExtractor extractor;
    private final RecordBuilder recordBuilder;
    private final ScrapeCache cache;
    private final ProxyRotator proxies;
    private final Sleeper sleeper;
    private final ScrapeClock clock;

    private volatile boolean closed;

    /** 기본 구현 */
    public ScrapeService(ScrapeConfig config) throws IOException {
        this(config,
             new PlaywrightPageFetcher(config.getBaseUrl()),
             ScrapeCaches.fromConfig(config.cache()),
             ProxyRotator.fromConfig(config.proxy()));
    }

    /** 페처/캐시/프록시 교체용 */
    public ScrapeService(ScrapeConfig config, PageFetcher fetcher, ScrapeCache cache, ProxyRotator proxies) {
        this(config, fetcher, new JsoupPageExtractor(config.getBaseUrl()), cache, proxies,
             new DefaultSleeper(), ScrapeClock.SYSTEM);
    }

    /** DI/테스트용 */
    public ScrapeService(ScrapeConfig config, PageFetcher fetcher, PageExtractor extractor, ScrapeCache cache,
                         ProxyRotator proxies, Sleeper sleeper, ScrapeClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.proxies = (proxies != null ? proxies : ProxyRotator.disabled());
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.recordBuilder = new RecordBuilder(config.getTimeZone());
    }

    // ---------------- single ----------------

    public ScrapeResult scrape(String identity) {
        return scrape(identity, false);
    }

    /**
     * @param forceRefresh true 면 캐시 조회를 건너뛴다(성공 시 기록은 그대로 함)
     * @throws IllegalArgumentException identity 가 비어 있을 때
     * @throws com.xingest.core.cache.CacheException 캐시 저장소 오작동
     */
    public ScrapeResult scrape(String identity, boolean forceRefresh) {
        String id = normalizeIdentity(identity);
        ensureOpen();
        long t0 = clock.nowMillis();
        SLOG.info("scrape-start", "identity", id, "forceRefresh", forceRefresh);

        if (!forceRefresh) {
            Optional<ScrapeResult> hit = cache.get(id);
            if (hit.isPresent()) {
                LOG.info("Cache hit: {} (age {}s)", id, hit.get().getCacheAgeSeconds());
                SLOG.info("cache-hit", "identity", id, "ageSec", hit.get().getCacheAgeSeconds());
                return hit.get();
            }
        }

        FetchOptions opts = FetchOptions.from(config.browser());
        Optional<String> proxy = proxies.next();
        if (proxy.isPresent()) opts = opts.withProxy(proxy.get());

        FetchResult fetched;
        try {
            fetched = fetcher.fetch(id, opts);
        } catch (RuntimeException e) {
            LOG.warn("Fetcher threw for {}: {}", id, e.toString());
            fetched = FetchResult.fail(e.getMessage() != null ? e.getMessage() : e.toString(), FetchFailure.GENERIC);
        }
        if (fetched == null) {
            fetched = FetchResult.fail("Fetcher returned no result", FetchFailure.GENERIC);
        }
        Instant fetchedAt = Instant.ofEpochMilli(clock.nowMillis());

        if (!fetched.success) {
            ScrapeResult failed = ScrapeResult.builder()
                    .success(false)
                    .username(id)
                    .errorMessage(fetched.error.orElse("Fetch failed"))
                    .fetchFailure(fetched.failure.orElse(FetchFailure.GENERIC))
                    .scrapedAt(fetchedAt)
                    .durationMs(clock.nowMillis() - t0)
                    .build();
            LOG.warn("Fetch failed: {} -> {}", id, failed.getErrorMessage());
            SLOG.warn("fetch-failed", "identity", id, "failure", failed.getFetchFailure(),
                    "status", fetched.status, "error", failed.getErrorMessage());
            return failed;
        }

        ExtractionOutcome extraction = extractor.extract(fetched.html, id);
        BuildOutcome built = recordBuilder.build(extraction, fetchedAt);

        ScrapeResult result = ScrapeResult.builder()
                .success(built.isSuccess())
                .username(id)
                .profile(built.getProfile())
                .posts(built.getPosts())
                .errorMessage(built.errorMessage())
                .scrapedAt(fetchedAt)
                .durationMs(clock.nowMillis() - t0)
                .build();

        if (result.isSuccess()) {
            cache.set(id, result);
            SLOG.debug("cache-write", "identity", id);
        }

        LOG.info("Scraped {}: success={}, posts={}, errors={}",
                id, result.isSuccess(), result.getPosts().size(), built.getErrors().size());
        SLOG.info("scrape-done", "identity", id, "success", result.isSuccess(),
                "posts", result.getPosts().size(), "errors", built.getErrors().size(),
                "durationMs", result.getDurationMs());
        return result;
    }

    // ---------------- batch ----------------

    public List<ScrapeResult> scrapeMany(List<String> identities) {
        return scrapeMany(identities, false);
    }

    public List<ScrapeResult> scrapeMany(List<String> identities, boolean forceRefresh) {
        return scrapeMany(identities, forceRefresh, config.getRequestDelay(), ProgressListener.NONE);
    }

    public List<ScrapeResult> scrapeMany(List<String> identities, boolean forceRefresh, ProgressListener listener) {
        return scrapeMany(identities, forceRefresh, config.getRequestDelay(), listener);
    }

    /**
     * 입력 순서/길이 그대로의 결과 목록. 중복 identity 는 두 번째부터 캐시 히트가 된다.
     * 대기 중 인터럽트되면 인터럽트 플래그를 복구하고 CancellationException.
     */
    public List<ScrapeResult> scrapeMany(List<String> identities, boolean forceRefresh,
                                         Duration pacing, ProgressListener listener) {
        Objects.requireNonNull(identities, "identities");
        ProgressListener progress = (listener != null ? listener : ProgressListener.NONE);
        Duration delay = (pacing == null || pacing.isNegative()) ? Duration.ZERO : pacing;

        int total = identities.size();
        List<ScrapeResult> results = new ArrayList<>(total);
        int ok = 0, fromCache = 0;

        for (int i = 0; i < total; i++) {
            ScrapeResult r = scrape(identities.get(i), forceRefresh);
            results.add(r);
            if (r.isSuccess()) ok++;
            if (r.isCached()) fromCache++;
            progress.onProgress((i + 1) / (double) total, PHASE, i + 1, total);

            if (i < total - 1 && !delay.isZero()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while pacing batch after " + (i + 1) + "/" + total);
                }
            }
        }

        LOG.info("Batch done: total={}, success={}, cached={}", total, ok, fromCache);
        SLOG.info("batch-done", "total", total, "success", ok, "cached", fromCache);
        return results;
    }

    // ---------------- cache admin ----------------

    public boolean invalidateCache(String identity) {
        String id = normalizeIdentity(identity);
        ensureOpen();
        return cache.invalidate(id);
    }

    public void clearCache() {
        ensureOpen();
        cache.clear();
    }

    /** @return 정리된 만료 항목 수 */
    public int cleanupCache() {
        ensureOpen();
        return cache.cleanupExpired();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        cache.close();
        LOG.debug("ScrapeService closed");
    }

    public ScrapeConfig getConfig() { return config; }

    /** "@NASA " → "nasa". 비어 있으면 IllegalArgumentException. */
    public static String normalizeIdentity(String identity) {
        if (identity == null) throw new IllegalArgumentException("identity must not be null");
        String s = identity.trim();
        if (s.startsWith("@")) s = s.substring(1).trim();
        if (s.isEmpty()) throw new IllegalArgumentException("identity must not be blank");
        return s.toLowerCase(Locale.ROOT);
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("ScrapeService is closed");
    }
}

package com.xingest.core.fetch;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import com.xingest.core.extract.Selectors;
import com.xingest.core.model.FetchFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Playwright(Chromium) 페처: 호출마다 브라우저를 띄우고 반드시 닫는다.
 * 1) launch(headless, proxy) → 1920x1080 컨텍스트
 * 2) baseUrl/identity 로 이동(DOMCONTENTLOADED)
 * 3) 상태코드 분류 → 본문 셀렉터 대기(best-effort) → page.content()
 */
public class PlaywrightPageFetcher implements PageFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightPageFetcher.class);

    static final List<String> USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0"
    );

    private static final double CONTENT_WAIT_MS = 5_000;

    private final String baseUrl;
    private final AtomicInteger uaCursor = new AtomicInteger();

    public PlaywrightPageFetcher(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl").replaceAll("/+$", "");
    }

    @Override
    public FetchResult fetch(String identity, FetchOptions options) {
        String url = profileUrl(baseUrl, identity);
        String ua = (options.getUserAgent() != null ? options.getUserAgent() : nextUserAgent());
        double timeoutMs = options.getTimeout().toMillis();

        BrowserType.LaunchOptions launch = new BrowserType.LaunchOptions().setHeadless(options.isHeadless());
        if (options.getProxy() != null) launch.setProxy(options.getProxy());

        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(launch);
            try {
                BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                        .setViewportSize(1920, 1080)
                        .setUserAgent(ua));
                Page page = context.newPage();

                Response response = page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                        .setTimeout(timeoutMs));

                FetchResult failed = classify(response, url);
                if (failed != null) return failed;

                waitBestEffort(page, Selectors.PRIMARY_COLUMN, timeoutMs);
                waitBestEffort(page, Selectors.POST, CONTENT_WAIT_MS);

                String html = page.content();
                LOG.debug("fetched {} ({} chars, status {})", url, html.length(), response.status());
                return FetchResult.ok(html, response.status());
            } finally {
                browser.close();
            }
        } catch (TimeoutError e) {
            LOG.warn("timeout fetching {}: {}", url, e.getMessage());
            return FetchResult.fail("Timeout loading " + url + ": " + firstLine(e.getMessage()), FetchFailure.TIMEOUT);
        } catch (PlaywrightException e) {
            LOG.warn("browser error fetching {}: {}", url, e.getMessage());
            return FetchResult.fail("Browser error: " + firstLine(e.getMessage()), FetchFailure.TRANSPORT);
        }
    }

    /** 실패면 FetchResult, 정상이면 null */
    static FetchResult classify(Response response, String url) {
        if (response == null) {
            return FetchResult.fail("No response from " + url, FetchFailure.NO_RESPONSE);
        }
        return classifyStatus(response.status(), url);
    }

    static FetchResult classifyStatus(int status, String url) {
        FetchFailure kind = FetchFailure.fromStatus(status);
        if (kind == null) return null;
        switch (kind) {
            case NOT_FOUND: return FetchResult.fail("Profile not found: " + url, kind, status);
            case BLOCKED:   return FetchResult.fail("Blocked (HTTP " + status + "): " + url, kind, status);
            default:        return FetchResult.fail("HTTP " + status + " for " + url, kind, status);
        }
    }

    static String profileUrl(String baseUrl, String identity) {
        String id = identity.trim();
        if (id.startsWith("@")) id = id.substring(1);
        return baseUrl + "/" + id;
    }

    String nextUserAgent() {
        return USER_AGENTS.get(Math.floorMod(uaCursor.getAndIncrement(), USER_AGENTS.size()));
    }

    private static void waitBestEffort(Page page, String selector, double timeoutMs) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(timeoutMs));
        } catch (TimeoutError e) {
            LOG.debug("selector {} not visible within {}ms", selector, (long) timeoutMs);
        }
    }

    private static String firstLine(String msg) {
        if (msg == null) return "";
        int nl = msg.indexOf('\n');
        return nl < 0 ? msg : msg.substring(0, nl);
    }
}

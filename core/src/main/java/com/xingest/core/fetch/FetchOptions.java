package com.xingest.core.fetch;

import com.xingest.core.model.ScrapeConfig;

import java.time.Duration;
import java.util.Objects;

/** 페치 1회 옵션(불변). userAgent/proxy 는 null 허용. */
public final class FetchOptions {
    private final boolean headless;
    private final Duration timeout;
    private final String userAgent;
    private final String proxy;

    public FetchOptions(boolean headless, Duration timeout, String userAgent, String proxy) {
        this.headless = headless;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = userAgent;
        this.proxy = proxy;
    }

    public static FetchOptions defaults() {
        return from(new ScrapeConfig.BrowserCfg());
    }

    public static FetchOptions from(ScrapeConfig.BrowserCfg cfg) {
        return new FetchOptions(cfg.isHeadless(), cfg.getTimeout(), cfg.getUserAgent(), null);
    }

    public FetchOptions withProxy(String proxy) {
        return new FetchOptions(headless, timeout, userAgent, proxy);
    }

    public boolean isHeadless() { return headless; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public String getProxy() { return proxy; }

    @Override public String toString() {
        return "FetchOptions{headless=" + headless + ", timeout=" + timeout
                + ", userAgent=" + (userAgent != null) + ", proxy=" + (proxy != null) + "}";
    }
}

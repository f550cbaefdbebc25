package com.xingest.core.cache;

import com.xingest.core.model.ScrapeConfig;
import com.xingest.core.util.ScrapeClock;

import java.util.Objects;

/** 설정의 cache.backend 에 맞는 구현 생성 */
public final class ScrapeCaches {
    private ScrapeCaches() {}

    public static ScrapeCache fromConfig(ScrapeConfig.CacheCfg cfg) {
        return fromConfig(cfg, ScrapeClock.SYSTEM);
    }

    public static ScrapeCache fromConfig(ScrapeConfig.CacheCfg cfg, ScrapeClock clock) {
        Objects.requireNonNull(cfg, "cfg");
        switch (cfg.getBackend()) {
            case MEMORY: return new InMemoryScrapeCache(clock, cfg.getTtl());
            case NONE:   return new DisabledScrapeCache();
            case FILE:
            default:     return new FileScrapeCache(cfg.getDir(), clock, cfg.getTtl());
        }
    }
}

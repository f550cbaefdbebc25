package com.xingest.core.util;

import com.xingest.core.model.ScrapeConfig;
import com.xingest.core.model.ScrapeConfig.CacheBackend;
import com.xingest.core.model.ScrapeConfig.ProxyMode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * xingest.yml → ScrapeConfig.
 *
 * 예상 YAML 키:
 * baseUrl: "https://x.com"
 * requestDelayMs: 1000
 * timeZone: "UTC"
 * browser:
 *   headless: true
 *   timeoutMs: 30000
 *   userAgent: "..."
 * cache:
 *   backend: MEMORY | FILE | NONE
 *   ttlSeconds: 300
 *   dir: ".xingest_cache"
 * proxy:
 *   mode: ROUND_ROBIN | RANDOM | NONE
 *   urls: ["http://p1:8080", "http://p2:8080"]
 *   file: "proxies.txt"
 * log:
 *   dir: "logs"
 *   level: INFO
 *
 * 시스템 프로퍼티 오버라이드(있으면 YAML 보다 우선):
 *   -Dxi.cache.ttlSeconds=60
 *   -Dxi.requestDelayMs=2500
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static final String DEFAULT_FILE = "xingest.yml";
    public static final String PROP_CACHE_TTL = "xi.cache.ttlSeconds";
    public static final String PROP_REQUEST_DELAY = "xi.requestDelayMs";

    public static ScrapeConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ScrapeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ScrapeConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ScrapeConfig cfg = ScrapeConfig.defaults();
        if (root instanceof Map<?, ?> map) {
            apply(map, cfg);
        }
        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    private static void apply(Map<?, ?> map, ScrapeConfig cfg) {
        // 1) 평면 키
        setString(map, "baseUrl", cfg::setBaseUrl);
        setLong(map, "requestDelayMs", cfg::setRequestDelayMs);
        setString(map, "timeZone", z -> cfg.setTimeZone(zone(z)));

        // 2) browser.*
        Map<String, Object> browser = getMap(map, "browser");
        if (browser != null) {
            var b = cfg.browser();
            setBoolean(browser, "headless", b::setHeadless);
            setLong(browser, "timeoutMs", b::setTimeoutMs);
            setString(browser, "userAgent", b::setUserAgent);
        }

        // 3) cache.*
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            var c = cfg.cache();
            setEnum(cache, "backend", CacheBackend.class, c::setBackend);
            setLong(cache, "ttlSeconds", c::setTtlSeconds);
            setPath(cache, "dir", c::setDir);
        }

        // 4) proxy.*
        Map<String, Object> proxy = getMap(map, "proxy");
        if (proxy != null) {
            var p = cfg.proxy();
            setEnum(proxy, "mode", ProxyMode.class, p::setMode);
            setStringList(proxy, "urls", p::setUrls);
            setPath(proxy, "file", p::setFile);
        }

        // 5) log.*
        Map<String, Object> log = getMap(map, "log");
        if (log != null) {
            setPath(log, "dir", cfg::setLogDir);
            setString(log, "level", cfg::setLogLevel);
        }
    }

    /** SysProp 우선. 숫자가 아니면 설정 오류로 본다. */
    static void applySystemOverrides(ScrapeConfig cfg) {
        Long ttl = longProperty(PROP_CACHE_TTL);
        if (ttl != null) cfg.cache().setTtlSeconds(ttl);
        Long delay = longProperty(PROP_REQUEST_DELAY);
        if (delay != null) cfg.setRequestDelayMs(delay);
    }

    private static Long longProperty(String name) {
        String v = System.getProperty(name);
        if (v == null || v.isBlank()) return null;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("-D" + name + " must be a number: " + v, e);
        }
    }

    private static ZoneId zone(String id) {
        try {
            return ZoneId.of(id.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid timeZone: " + id, e);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_');
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("Unknown " + key + ": " + v
                + " (expected one of " + List.of(type.getEnumConstants()) + ")");
    }
}

package com.xingest.core.proxy;

import com.xingest.core.model.ScrapeConfig.ProxyCfg;
import com.xingest.core.model.ScrapeConfig.ProxyMode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * 고정 프록시 풀에서 다음 엔드포인트를 고른다.
 * 카운터가 유일한 공유 가변 상태이며 인스턴스 모니터로 보호한다(호출 1회 = 전진 1회).
 */
public final class ProxyRotator {

    private final List<String> proxies;
    private final ProxyMode mode;
    private final Random random;
    private int index = 0;

    public ProxyRotator(List<String> proxies, ProxyMode mode) {
        this(proxies, mode, new Random());
    }

    /** DI/테스트용: random 시드 고정 가능 */
    public ProxyRotator(List<String> proxies, ProxyMode mode, Random random) {
        this.proxies = List.copyOf(Objects.requireNonNull(proxies, "proxies"));
        this.mode = (mode == null ? ProxyMode.NONE : mode);
        this.random = Objects.requireNonNull(random, "random");
    }

    public static ProxyRotator disabled() {
        return new ProxyRotator(List.of(), ProxyMode.NONE);
    }

    /** 한 줄에 URL 하나. 빈 줄과 '#' 주석은 건너뛴다. */
    public static ProxyRotator fromFile(Path file, ProxyMode mode) throws IOException {
        List<String> urls = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String s = line.trim();
            if (s.isEmpty() || s.startsWith("#")) continue;
            urls.add(s);
        }
        return new ProxyRotator(urls, mode);
    }

    /** proxy.urls 와 proxy.file 을 합친다(urls 먼저) */
    public static ProxyRotator fromConfig(ProxyCfg cfg) throws IOException {
        List<String> all = new ArrayList<>(cfg.getUrls());
        if (cfg.getFile() != null) all.addAll(fromFile(cfg.getFile(), cfg.getMode()).proxies);
        return new ProxyRotator(all, cfg.getMode());
    }

    public synchronized Optional<String> next() {
        if (mode == ProxyMode.NONE || proxies.isEmpty()) return Optional.empty();
        if (mode == ProxyMode.RANDOM) {
            return Optional.of(proxies.get(random.nextInt(proxies.size())));
        }
        String p = proxies.get(index);
        index = (index + 1) % proxies.size();
        return Optional.of(p);
    }

    public boolean isEnabled() {
        return mode != ProxyMode.NONE && !proxies.isEmpty();
    }

    public int size() { return proxies.size(); }
    public ProxyMode getMode() { return mode; }
    public List<String> getProxies() { return proxies; }
}

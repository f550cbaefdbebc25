package com.xingest.core.util;

import com.xingest.core.model.ScrapeConfig;
import com.xingest.core.model.ScrapeConfig.CacheBackend;
import com.xingest.core.model.ScrapeConfig.ProxyMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private static ScrapeConfig fromString(String yaml) {
        return YamlConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("전체 키 매핑")
    void full_file_is_mapped() throws Exception {
        Path f = tmp.resolve("xingest.yml");
        Files.writeString(f, String.join("\n",
                "baseUrl: \"https://x.example/\"",
                "requestDelayMs: 2500",
                "timeZone: Asia/Seoul",
                "browser:",
                "  headless: false",
                "  timeoutMs: 45000",
                "  userAgent: \"TestAgent/1.0\"",
                "cache:",
                "  backend: memory",
                "  ttlSeconds: 60",
                "  dir: /tmp/xi-cache",
                "proxy:",
                "  mode: round-robin",
                "  urls: [\"http://p1:8080\", \"http://p2:8080\"]",
                "log:",
                "  dir: out/logs",
                "  level: DEBUG",
                ""));

        ScrapeConfig cfg = YamlConfigLoader.load(f);

        assertThat(cfg.getBaseUrl()).isEqualTo("https://x.example");
        assertThat(cfg.getRequestDelay()).isEqualTo(Duration.ofMillis(2500));
        assertThat(cfg.getTimeZone()).isEqualTo(ZoneId.of("Asia/Seoul"));
        assertThat(cfg.browser().isHeadless()).isFalse();
        assertThat(cfg.browser().getTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(cfg.browser().getUserAgent()).isEqualTo("TestAgent/1.0");
        assertThat(cfg.cache().getBackend()).isEqualTo(CacheBackend.MEMORY);
        assertThat(cfg.cache().getTtl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(cfg.cache().getDir()).isEqualTo(Path.of("/tmp/xi-cache"));
        assertThat(cfg.proxy().getMode()).isEqualTo(ProxyMode.ROUND_ROBIN);
        assertThat(cfg.proxy().getUrls()).containsExactly("http://p1:8080", "http://p2:8080");
        assertThat(cfg.getLogDir()).isEqualTo(Path.of("out/logs"));
        assertThat(cfg.getLogLevel()).isEqualTo("DEBUG");
    }

    @Test
    void empty_document_keeps_defaults() {
        ScrapeConfig cfg = fromString("");
        assertThat(cfg.getBaseUrl()).isEqualTo("https://x.com");
        assertThat(cfg.getRequestDelay()).isEqualTo(Duration.ofMillis(1000));
        assertThat(cfg.getTimeZone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(cfg.browser().isHeadless()).isTrue();
        assertThat(cfg.browser().getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.cache().getBackend()).isEqualTo(CacheBackend.FILE);
        assertThat(cfg.cache().getTtl()).isEqualTo(Duration.ofSeconds(300));
        assertThat(cfg.cache().getDir()).isEqualTo(Path.of(".xingest_cache"));
        assertThat(cfg.proxy().getMode()).isEqualTo(ProxyMode.NONE);
    }

    @Test
    void comma_separated_proxy_list_is_accepted() {
        ScrapeConfig cfg = fromString("proxy:\n  mode: RANDOM\n  urls: \"http://a:1, http://b:2\"\n");
        assertThat(cfg.proxy().getMode()).isEqualTo(ProxyMode.RANDOM);
        assertThat(cfg.proxy().getUrls()).isEqualTo(List.of("http://a:1", "http://b:2"));
    }

    @Test
    void system_properties_override_yaml() {
        System.setProperty(YamlConfigLoader.PROP_CACHE_TTL, "42");
        System.setProperty(YamlConfigLoader.PROP_REQUEST_DELAY, "10");
        try {
            ScrapeConfig cfg = fromString("requestDelayMs: 5000\ncache:\n  ttlSeconds: 600\n");
            assertThat(cfg.cache().getTtl()).isEqualTo(Duration.ofSeconds(42));
            assertThat(cfg.getRequestDelay()).isEqualTo(Duration.ofMillis(10));
        } finally {
            System.clearProperty(YamlConfigLoader.PROP_CACHE_TTL);
            System.clearProperty(YamlConfigLoader.PROP_REQUEST_DELAY);
        }
    }

    @Test
    void unknown_enum_value_is_rejected() {
        assertThatThrownBy(() -> fromString("cache:\n  backend: redis\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("backend");
    }

    @Test
    void invalid_base_url_fails_validation() {
        assertThatThrownBy(() -> fromString("baseUrl: ftp://x.com\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("baseUrl");
    }

    @Test
    void missing_file_is_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}

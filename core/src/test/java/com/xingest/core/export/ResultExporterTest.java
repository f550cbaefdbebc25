package com.xingest.core.export;

import com.xingest.core.model.ScrapeResult;
import com.xingest.core.util.Fixtures;
import com.xingest.core.util.ScrapeJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultExporterTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    @TempDir
    Path tmp;

    private final ResultExporter exporter =
            new ResultExporter(ScrapeJson.mapper(), Clock.fixed(Instant.parse("2026-03-11T00:00:00Z"), ZoneOffset.UTC));

    private static ScrapeResult failed(String username) {
        return ScrapeResult.builder().success(false).username(username).errorMessage("Profile not found").scrapedAt(T0).build();
    }

    @Test
    void save_and_load_single_result() throws Exception {
        ScrapeResult r = Fixtures.sampleResult("nasa", T0);
        Path f = exporter.saveJson(r, tmp.resolve("out/deep/nasa.json"));

        assertThat(f).isRegularFile();
        assertThat(Files.readString(f)).contains("\n");  // pretty print
        assertThat(exporter.loadJson(f)).isEqualTo(r);
    }

    @Test
    void to_map_uses_iso_dates() {
        Map<String, Object> m = exporter.toMap(Fixtures.sampleResult("nasa", T0));
        assertThat(m).containsEntry("username", "nasa").containsEntry("scrapedAt", "2026-03-10T12:00:00Z");
    }

    @Test
    void save_many_writes_only_results_with_profile() throws Exception {
        List<Path> saved = exporter.saveManyJson(
                List.of(Fixtures.sampleResult("a", T0), failed("ghost"), Fixtures.sampleResult("b", T0)),
                tmp, "scrape_{username}.json");

        assertThat(saved).extracting(p -> p.getFileName().toString())
                .containsExactly("scrape_a.json", "scrape_b.json");
        assertThat(tmp.resolve("scrape_ghost.json")).doesNotExist();
    }

    @Test
    void template_without_placeholder_is_rejected() {
        assertThatThrownBy(() -> exporter.saveManyJson(List.of(), tmp, "fixed.json"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void merge_combines_profiles_and_tags_posts() {
        Map<String, Object> merged = exporter.mergeResults(
                List.of(Fixtures.sampleResult("a", T0), failed("ghost"), Fixtures.sampleResult("b", T0)));

        assertThat(merged).containsKeys("exported_at", "profiles_count", "posts_count", "profiles", "posts");
        assertThat(merged.get("exported_at")).isEqualTo("2026-03-11T00:00:00Z");
        assertThat(merged.get("profiles_count")).isEqualTo(2);
        assertThat(merged.get("posts_count")).isEqualTo(4);

        List<Map<String, Object>> posts = (List<Map<String, Object>>) merged.get("posts");
        assertThat(posts).extracting(p -> p.get("_username")).containsExactly("a", "a", "b", "b");
    }

    @Test
    void merge_to_json_is_valid_document() throws Exception {
        String json = exporter.mergeToJson(List.of(Fixtures.sampleResult("a", T0)));
        assertThat(ScrapeJson.mapper().readTree(json).get("posts_count").asInt()).isEqualTo(2);
    }
}

package com.xingest.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xingest.core.model.PostRecord;
import com.xingest.core.model.ScrapeResult;
import com.xingest.core.util.ScrapeJson;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** ScrapeResult JSON 내보내기/불러오기 */
public final class ResultExporter {

    public static final String DEFAULT_TEMPLATE = "{username}.json";
    private static final String PLACEHOLDER = "{username}";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper om;
    private final Clock clock;

    public ResultExporter() {
        this(ScrapeJson.mapper(), Clock.systemUTC());
    }

    ResultExporter(ObjectMapper om, Clock clock) {
        this.om = Objects.requireNonNull(om, "om");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String toJson(ScrapeResult result) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize result for " + result.getUsername(), e);
        }
    }

    public Map<String, Object> toMap(ScrapeResult result) {
        return om.convertValue(result, MAP_TYPE);
    }

    /** 상위 디렉터리가 없으면 만든다 */
    public Path saveJson(ScrapeResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, toJson(result), StandardCharsets.UTF_8);
        return file;
    }

    public ScrapeResult loadJson(Path file) throws IOException {
        return om.readValue(Files.readString(file, StandardCharsets.UTF_8), ScrapeResult.class);
    }

    public List<Path> saveManyJson(List<ScrapeResult> results, Path dir) throws IOException {
        return saveManyJson(results, dir, DEFAULT_TEMPLATE);
    }

    /** 프로필이 있는 결과만 파일로 쓴다. template 의 {username} 은 프로필 username 으로 치환. */
    public List<Path> saveManyJson(List<ScrapeResult> results, Path dir, String template) throws IOException {
        if (template == null || !template.contains(PLACEHOLDER)) {
            throw new IllegalArgumentException("template must contain " + PLACEHOLDER + ": " + template);
        }
        Files.createDirectories(dir);
        List<Path> saved = new ArrayList<>();
        for (ScrapeResult r : results) {
            if (r.getProfile() == null) continue;
            Path f = dir.resolve(template.replace(PLACEHOLDER, r.getProfile().getUsername()));
            saved.add(saveJson(r, f));
        }
        return saved;
    }

    /**
     * 여러 결과를 하나의 문서로 합친다:
     * exported_at, profiles_count, posts_count, profiles[], posts[] (각 포스트에 _username)
     */
    public Map<String, Object> mergeResults(List<ScrapeResult> results) {
        List<Map<String, Object>> profiles = new ArrayList<>();
        List<Map<String, Object>> posts = new ArrayList<>();

        for (ScrapeResult r : results) {
            if (r.getProfile() != null) profiles.add(om.convertValue(r.getProfile(), MAP_TYPE));
            for (PostRecord p : r.getPosts()) {
                Map<String, Object> m = om.convertValue(p, MAP_TYPE);
                if (r.getProfile() != null) m.put("_username", r.getProfile().getUsername());
                posts.add(m);
            }
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("exported_at", Instant.now(clock).toString());
        out.put("profiles_count", profiles.size());
        out.put("posts_count", posts.size());
        out.put("profiles", profiles);
        out.put("posts", posts);
        return out;
    }

    public String mergeToJson(List<ScrapeResult> results) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(mergeResults(results));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize merged export", e);
        }
    }
}

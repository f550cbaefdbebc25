package com.xingest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 스크레이프 1회 결과. 캐시 저장 단위이자 모든 호출자에게 반환되는 단위.
 * 캐시 히트 시에는 toBuilder()로 cached/cacheAgeSeconds만 덮어쓴 사본을 돌려준다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = ScrapeResult.Builder.class)
public final class ScrapeResult {
    private final boolean success;
    private final String username;
    private final ProfileRecord profile;     // nullable
    private final List<PostRecord> posts;    // 페이지 순서 유지
    private final boolean cached;
    private final Double cacheAgeSeconds;    // nullable
    private final String errorMessage;       // nullable
    private final FetchFailure fetchFailure; // nullable
    private final Instant scrapedAt;
    private final double durationMs;

    private ScrapeResult(Builder b) {
        this.success = b.success;
        this.username = b.username;
        this.profile = b.profile;
        this.posts = List.copyOf(b.posts);
        this.cached = b.cached;
        this.cacheAgeSeconds = b.cacheAgeSeconds;
        this.errorMessage = b.errorMessage;
        this.fetchFailure = b.fetchFailure;
        this.scrapedAt = (b.scrapedAt == null ? Instant.now() : b.scrapedAt);
        this.durationMs = b.durationMs;
    }

    public boolean isSuccess() { return success; }
    public String getUsername() { return username; }
    public ProfileRecord getProfile() { return profile; }
    public List<PostRecord> getPosts() { return posts; }
    public boolean isCached() { return cached; }
    public Double getCacheAgeSeconds() { return cacheAgeSeconds; }
    public String getErrorMessage() { return errorMessage; }
    public FetchFailure getFetchFailure() { return fetchFailure; }
    public Instant getScrapedAt() { return scrapedAt; }
    public double getDurationMs() { return durationMs; }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .success(success)
                .username(username)
                .profile(profile)
                .posts(posts)
                .cached(cached)
                .cacheAgeSeconds(cacheAgeSeconds)
                .errorMessage(errorMessage)
                .fetchFailure(fetchFailure)
                .scrapedAt(scrapedAt)
                .durationMs(durationMs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScrapeResult)) return false;
        ScrapeResult r = (ScrapeResult) o;
        return success == r.success
                && cached == r.cached
                && Double.compare(durationMs, r.durationMs) == 0
                && Objects.equals(username, r.username)
                && Objects.equals(profile, r.profile)
                && posts.equals(r.posts)
                && Objects.equals(cacheAgeSeconds, r.cacheAgeSeconds)
                && Objects.equals(errorMessage, r.errorMessage)
                && fetchFailure == r.fetchFailure
                && Objects.equals(scrapedAt, r.scrapedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, username, profile, posts, cached, cacheAgeSeconds,
                errorMessage, fetchFailure, scrapedAt, durationMs);
    }

    @Override
    public String toString() {
        return "ScrapeResult{@" + username + ", success=" + success + ", posts=" + posts.size()
                + ", cached=" + cached + (errorMessage == null ? "" : ", error=" + errorMessage) + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private boolean success;
        private String username;
        private ProfileRecord profile;
        private List<PostRecord> posts = new ArrayList<>();
        private boolean cached;
        private Double cacheAgeSeconds;
        private String errorMessage;
        private FetchFailure fetchFailure;
        private Instant scrapedAt;
        private double durationMs;

        public Builder success(boolean success) { this.success = success; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder profile(ProfileRecord profile) { this.profile = profile; return this; }
        public Builder posts(List<PostRecord> posts) {
            this.posts = (posts == null ? new ArrayList<>() : new ArrayList<>(posts));
            return this;
        }
        public Builder cached(boolean cached) { this.cached = cached; return this; }
        public Builder cacheAgeSeconds(Double cacheAgeSeconds) { this.cacheAgeSeconds = cacheAgeSeconds; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder fetchFailure(FetchFailure fetchFailure) { this.fetchFailure = fetchFailure; return this; }
        public Builder scrapedAt(Instant scrapedAt) { this.scrapedAt = scrapedAt; return this; }
        public Builder durationMs(double durationMs) { this.durationMs = durationMs; return this; }

        public ScrapeResult build() {
            Objects.requireNonNull(username, "username");
            if (durationMs < 0) durationMs = 0;
            return new ScrapeResult(this);
        }
    }
}

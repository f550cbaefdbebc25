package com.xingest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Objects;

/** 프로필 메타데이터(정규화 완료) */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = ProfileRecord.Builder.class)
public final class ProfileRecord {
    private final String username;        // 소문자 정규화된 핸들(@ 없음)
    private final String displayName;
    private final String bio;             // nullable
    private final String websiteUrl;      // nullable
    private final String location;        // nullable
    private final YearMonth joinedDate;   // nullable, 월 단위 정밀도
    private final long followersCount;
    private final long followingCount;
    private final long totalPostsCount;
    private final boolean verified;
    private final Instant scrapedAt;

    private ProfileRecord(Builder b) {
        this.username = b.username.toLowerCase(Locale.ROOT);
        this.displayName = (b.displayName == null || b.displayName.isBlank()) ? b.username : b.displayName;
        this.bio = b.bio;
        this.websiteUrl = b.websiteUrl;
        this.location = b.location;
        this.joinedDate = b.joinedDate;
        this.followersCount = b.followersCount;
        this.followingCount = b.followingCount;
        this.totalPostsCount = b.totalPostsCount;
        this.verified = b.verified;
        this.scrapedAt = (b.scrapedAt == null ? Instant.now() : b.scrapedAt);
    }

    public String getUsername() { return username; }
    public String getDisplayName() { return displayName; }
    public String getBio() { return bio; }
    public String getWebsiteUrl() { return websiteUrl; }
    public String getLocation() { return location; }
    public YearMonth getJoinedDate() { return joinedDate; }
    public long getFollowersCount() { return followersCount; }
    public long getFollowingCount() { return followingCount; }
    public long getTotalPostsCount() { return totalPostsCount; }
    public boolean isVerified() { return verified; }
    public Instant getScrapedAt() { return scrapedAt; }

    public static Builder builder() { return new Builder(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProfileRecord)) return false;
        ProfileRecord p = (ProfileRecord) o;
        return followersCount == p.followersCount
                && followingCount == p.followingCount
                && totalPostsCount == p.totalPostsCount
                && verified == p.verified
                && username.equals(p.username)
                && Objects.equals(displayName, p.displayName)
                && Objects.equals(bio, p.bio)
                && Objects.equals(websiteUrl, p.websiteUrl)
                && Objects.equals(location, p.location)
                && Objects.equals(joinedDate, p.joinedDate)
                && Objects.equals(scrapedAt, p.scrapedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, displayName, bio, websiteUrl, location, joinedDate,
                followersCount, followingCount, totalPostsCount, verified, scrapedAt);
    }

    @Override
    public String toString() {
        return "ProfileRecord{@" + username + ", followers=" + followersCount + ", verified=" + verified + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String username;
        private String displayName;
        private String bio;
        private String websiteUrl;
        private String location;
        private YearMonth joinedDate;
        private long followersCount;
        private long followingCount;
        private long totalPostsCount;
        private boolean verified;
        private Instant scrapedAt;

        public Builder username(String username) { this.username = username; return this; }
        public Builder displayName(String displayName) { this.displayName = displayName; return this; }
        public Builder bio(String bio) { this.bio = bio; return this; }
        public Builder websiteUrl(String websiteUrl) { this.websiteUrl = websiteUrl; return this; }
        public Builder location(String location) { this.location = location; return this; }
        public Builder joinedDate(YearMonth joinedDate) { this.joinedDate = joinedDate; return this; }
        public Builder followersCount(long followersCount) { this.followersCount = followersCount; return this; }
        public Builder followingCount(long followingCount) { this.followingCount = followingCount; return this; }
        public Builder totalPostsCount(long totalPostsCount) { this.totalPostsCount = totalPostsCount; return this; }
        public Builder verified(boolean verified) { this.verified = verified; return this; }
        public Builder scrapedAt(Instant scrapedAt) { this.scrapedAt = scrapedAt; return this; }

        public ProfileRecord build() {
            Objects.requireNonNull(username, "username");
            if (username.isBlank()) throw new IllegalArgumentException("username must not be blank");
            if (followersCount < 0) throw new IllegalArgumentException("followersCount must be >= 0");
            if (followingCount < 0) throw new IllegalArgumentException("followingCount must be >= 0");
            if (totalPostsCount < 0) throw new IllegalArgumentException("totalPostsCount must be >= 0");
            return new ProfileRecord(this);
        }
    }
}

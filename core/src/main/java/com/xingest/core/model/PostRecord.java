package com.xingest.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 단일 포스트(정규화 완료).
 * - postId 는 숫자 문자열이며 레코드의 자연키
 * - reply/quote/repost 플래그가 true 이면 짝이 되는 참조값은 반드시 non-null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = PostRecord.Builder.class)
public final class PostRecord {
    private final String postId;
    private final String text;
    private final Instant createdAt;        // nullable
    private final boolean pinned;

    private final boolean reply;
    private final String replyToUsername;   // reply 일 때만
    private final boolean quote;
    private final String quotedPostId;      // quote 일 때만
    private final boolean repost;
    private final String repostSource;      // repost 일 때만

    private final long replyCount;
    private final long repostCount;
    private final long likeCount;
    private final Long viewCount;           // nullable
    private final List<String> mediaUrls;   // nullable
    private final String postUrl;

    private PostRecord(Builder b) {
        this.postId = b.postId;
        this.text = (b.text == null ? "" : b.text);
        this.createdAt = b.createdAt;
        this.pinned = b.pinned;
        this.reply = b.reply;
        this.replyToUsername = b.replyToUsername;
        this.quote = b.quote;
        this.quotedPostId = b.quotedPostId;
        this.repost = b.repost;
        this.repostSource = b.repostSource;
        this.replyCount = b.replyCount;
        this.repostCount = b.repostCount;
        this.likeCount = b.likeCount;
        this.viewCount = b.viewCount;
        this.mediaUrls = (b.mediaUrls == null ? null : List.copyOf(b.mediaUrls));
        this.postUrl = b.postUrl;
    }

    public String getPostId() { return postId; }
    public String getText() { return text; }
    public Instant getCreatedAt() { return createdAt; }
    public boolean isPinned() { return pinned; }
    public boolean isReply() { return reply; }
    public String getReplyToUsername() { return replyToUsername; }
    public boolean isQuote() { return quote; }
    public String getQuotedPostId() { return quotedPostId; }
    public boolean isRepost() { return repost; }
    public String getRepostSource() { return repostSource; }
    public long getReplyCount() { return replyCount; }
    public long getRepostCount() { return repostCount; }
    public long getLikeCount() { return likeCount; }
    public Long getViewCount() { return viewCount; }
    public List<String> getMediaUrls() { return mediaUrls; }
    public String getPostUrl() { return postUrl; }

    public static Builder builder() { return new Builder(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostRecord)) return false;
        PostRecord p = (PostRecord) o;
        return pinned == p.pinned && reply == p.reply && quote == p.quote && repost == p.repost
                && replyCount == p.replyCount && repostCount == p.repostCount && likeCount == p.likeCount
                && postId.equals(p.postId)
                && text.equals(p.text)
                && Objects.equals(createdAt, p.createdAt)
                && Objects.equals(replyToUsername, p.replyToUsername)
                && Objects.equals(quotedPostId, p.quotedPostId)
                && Objects.equals(repostSource, p.repostSource)
                && Objects.equals(viewCount, p.viewCount)
                && Objects.equals(mediaUrls, p.mediaUrls)
                && Objects.equals(postUrl, p.postUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(postId, text, createdAt, pinned, reply, replyToUsername, quote, quotedPostId,
                repost, repostSource, replyCount, repostCount, likeCount, viewCount, mediaUrls, postUrl);
    }

    @Override
    public String toString() {
        return "PostRecord{" + postId + (pinned ? ", pinned" : "") + (reply ? ", reply" : "")
                + (quote ? ", quote" : "") + (repost ? ", repost" : "") + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String postId;
        private String text;
        private Instant createdAt;
        private boolean pinned;
        private boolean reply;
        private String replyToUsername;
        private boolean quote;
        private String quotedPostId;
        private boolean repost;
        private String repostSource;
        private long replyCount;
        private long repostCount;
        private long likeCount;
        private Long viewCount;
        private List<String> mediaUrls;
        private String postUrl;

        public Builder postId(String postId) { this.postId = postId; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder pinned(boolean pinned) { this.pinned = pinned; return this; }
        public Builder reply(boolean reply) { this.reply = reply; return this; }
        public Builder replyToUsername(String replyToUsername) { this.replyToUsername = replyToUsername; return this; }
        public Builder quote(boolean quote) { this.quote = quote; return this; }
        public Builder quotedPostId(String quotedPostId) { this.quotedPostId = quotedPostId; return this; }
        public Builder repost(boolean repost) { this.repost = repost; return this; }
        public Builder repostSource(String repostSource) { this.repostSource = repostSource; return this; }
        public Builder replyCount(long replyCount) { this.replyCount = replyCount; return this; }
        public Builder repostCount(long repostCount) { this.repostCount = repostCount; return this; }
        public Builder likeCount(long likeCount) { this.likeCount = likeCount; return this; }
        public Builder viewCount(Long viewCount) { this.viewCount = viewCount; return this; }
        public Builder mediaUrls(List<String> mediaUrls) { this.mediaUrls = mediaUrls; return this; }
        public Builder postUrl(String postUrl) { this.postUrl = postUrl; return this; }

        public PostRecord build() {
            Objects.requireNonNull(postId, "postId");
            if (postId.isEmpty() || !postId.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("postId must be numeric: " + postId);
            }
            if (reply && replyToUsername == null) throw new IllegalStateException("reply without replyToUsername");
            if (quote && quotedPostId == null) throw new IllegalStateException("quote without quotedPostId");
            if (repost && repostSource == null) throw new IllegalStateException("repost without repostSource");
            if (replyCount < 0 || repostCount < 0 || likeCount < 0) {
                throw new IllegalArgumentException("engagement counters must be >= 0");
            }
            if (viewCount != null && viewCount < 0) throw new IllegalArgumentException("viewCount must be >= 0");
            Objects.requireNonNull(postUrl, "postUrl");
            return new PostRecord(this);
        }
    }
}

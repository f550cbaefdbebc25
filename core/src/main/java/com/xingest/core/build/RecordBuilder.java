package com.xingest.core.build;

import com.xingest.core.model.ExtractionOutcome;
import com.xingest.core.model.PostRecord;
import com.xingest.core.model.ProfileRecord;
import com.xingest.core.model.RawFields;
import com.xingest.core.normalize.Normalizer;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RawFields → 타입 레코드.
 * - 프로필/포스트 각각 독립 변환. 실패는 RecordResult 로 돌려받아 문자열로만 누적한다.
 * - 상대 시각("2h")은 reference(페치 완료 시각) 기준으로 해석한다.
 */
public final class RecordBuilder {

    public static final String NO_IDENTITY_BLOCK = "identity block not found";

    private final ZoneId zone;

    public RecordBuilder() {
        this(ZoneId.of("UTC"));
    }

    /** zone: "Mar 15" 처럼 달력만 있는 표기를 해석할 기준 존 */
    public RecordBuilder(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public BuildOutcome build(ExtractionOutcome extraction, Instant reference) {
        Objects.requireNonNull(extraction, "extraction");
        Objects.requireNonNull(reference, "reference");

        List<String> errors = new ArrayList<>();

        RecordResult<ProfileRecord> profile = buildProfile(extraction.getProfile(), reference);
        profile.error().ifPresent(errors::add);

        ZonedDateTime ref = reference.atZone(zone);
        List<PostRecord> posts = new ArrayList<>();
        for (RawFields raw : extraction.getPosts()) {
            RecordResult<PostRecord> r = buildPost(raw, ref);
            r.value().ifPresent(posts::add);
            r.error().ifPresent(errors::add);
        }

        errors.addAll(extraction.getErrors());
        return new BuildOutcome(profile.value().orElse(null), posts, errors, !profile.isOk());
    }

    RecordResult<ProfileRecord> buildProfile(RawFields raw, Instant scrapedAt) {
        String username = raw.get(RawFields.USERNAME).orElse(null);
        if (username == null || username.isBlank()) {
            return RecordResult.failed(NO_IDENTITY_BLOCK);
        }
        try {
            ProfileRecord p = ProfileRecord.builder()
                    .username(username.trim())
                    .displayName(raw.get(RawFields.DISPLAY_NAME).orElse(null))
                    .bio(raw.get(RawFields.BIO).orElse(null))
                    .websiteUrl(raw.get(RawFields.WEBSITE_URL).orElse(null))
                    .location(raw.get(RawFields.LOCATION).orElse(null))
                    .joinedDate(raw.get(RawFields.JOINED_DATE_RAW).flatMap(Normalizer::parseJoinedDate).orElse(null))
                    .followersCount(Normalizer.normalizeCount(raw.getOrDefault(RawFields.FOLLOWERS_RAW, "0")))
                    .followingCount(Normalizer.normalizeCount(raw.getOrDefault(RawFields.FOLLOWING_RAW, "0")))
                    .totalPostsCount(Normalizer.normalizeCount(raw.getOrDefault(RawFields.POSTS_COUNT_RAW, "0")))
                    .verified(raw.flag(RawFields.VERIFIED))
                    .scrapedAt(scrapedAt)
                    .build();
            return RecordResult.ok(p);
        } catch (RuntimeException e) {
            return RecordResult.failed("Profile build error: " + e.getMessage());
        }
    }

    RecordResult<PostRecord> buildPost(RawFields raw, ZonedDateTime reference) {
        String id = raw.get(RawFields.POST_ID).orElse(null);
        if (id == null) {
            return RecordResult.failed("Post build error: missing post id");
        }
        try {
            String replyTo = raw.get(RawFields.REPLY_TO).orElse(null);
            String quoted = raw.get(RawFields.QUOTED_ID).orElse(null);
            String source = raw.get(RawFields.REPOST_SOURCE).orElse(null);
            List<String> media = raw.getAll(RawFields.MEDIA_URLS);

            PostRecord p = PostRecord.builder()
                    .postId(id)
                    .postUrl(raw.get(RawFields.POST_URL).orElse(null))
                    .text(raw.getOrDefault(RawFields.TEXT, ""))
                    .createdAt(raw.get(RawFields.CREATED_AT_RAW)
                            .flatMap(s -> Normalizer.parsePostTimestamp(s, reference))
                            .orElse(null))
                    .pinned(raw.flag(RawFields.PINNED))
                    .reply(replyTo != null).replyToUsername(replyTo)
                    .quote(quoted != null).quotedPostId(quoted)
                    .repost(source != null).repostSource(source)
                    .replyCount(Normalizer.normalizeCount(raw.getOrDefault(RawFields.REPLY_COUNT_RAW, "0")))
                    .repostCount(Normalizer.normalizeCount(raw.getOrDefault(RawFields.REPOST_COUNT_RAW, "0")))
                    .likeCount(Normalizer.normalizeCount(raw.getOrDefault(RawFields.LIKE_COUNT_RAW, "0")))
                    .viewCount(raw.get(RawFields.VIEW_COUNT_RAW)
                            .map(Normalizer::normalizeCount)
                            .filter(v -> v > 0)      // 0/파싱 불가는 부재로 본다
                            .orElse(null))
                    .mediaUrls(media.isEmpty() ? null : media)
                    .build();
            return RecordResult.ok(p);
        } catch (RuntimeException e) {
            return RecordResult.failed("Post " + id + " build error: " + e.getMessage());
        }
    }
}

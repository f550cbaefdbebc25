package com.xingest.core.util;

import com.xingest.core.model.PostRecord;
import com.xingest.core.model.ProfileRecord;
import com.xingest.core.model.ScrapeResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

/** src/test/resources/fixtures 읽기 */
public final class Fixtures {
    private Fixtures() {}

    public static String html(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalStateException("fixture not found: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** UserName 블록 + 팔로워 + 포스트 1건짜리 최소 페이지 */
    public static String minimalProfile(String handle, String postId) {
        return "<html><body>"
                + "<div data-testid=\"UserName\"><span>" + handle + " Display</span><span>@" + handle + "</span></div>"
                + "<a href=\"/" + handle + "/verified_followers\"><span>10</span> Followers</a>"
                + "<article data-testid=\"tweet\">"
                + "<a href=\"/" + handle + "/status/" + postId + "\"><time datetime=\"2026-01-01T00:00:00.000Z\">Jan 1</time></a>"
                + "<div data-testid=\"tweetText\">hello from " + handle + "</div>"
                + "</article>"
                + "</body></html>";
    }

    /** 캐시/내보내기 테스트용 성공 결과 (포스트 2건) */
    public static ScrapeResult sampleResult(String username, Instant at) {
        ProfileRecord profile = ProfileRecord.builder()
                .username(username)
                .displayName(username.toUpperCase())
                .bio("bio of " + username)
                .joinedDate(YearMonth.of(2015, 6))
                .followersCount(1_200)
                .followingCount(34)
                .totalPostsCount(56)
                .verified(true)
                .scrapedAt(at)
                .build();
        PostRecord p1 = PostRecord.builder()
                .postId("101")
                .postUrl("https://x.com/" + username + "/status/101")
                .text("first")
                .createdAt(at.minusSeconds(3600))
                .pinned(true)
                .likeCount(7)
                .viewCount(1_000L)
                .mediaUrls(List.of("https://pbs.twimg.com/media/A.jpg"))
                .build();
        PostRecord p2 = PostRecord.builder()
                .postId("102")
                .postUrl("https://x.com/" + username + "/status/102")
                .text("second")
                .reply(true).replyToUsername("someone")
                .build();
        return ScrapeResult.builder()
                .success(true)
                .username(username)
                .profile(profile)
                .posts(List.of(p1, p2))
                .scrapedAt(at)
                .durationMs(12.5)
                .build();
    }
}

package com.xingest.core.extract;

import com.xingest.core.model.ExtractionOutcome;
import com.xingest.core.model.RawFields;
import com.xingest.core.util.Fixtures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsoupPageExtractor: profile.html fixture")
class JsoupPageExtractorTest {

    private final JsoupPageExtractor extractor = new JsoupPageExtractor();
    private ExtractionOutcome out;

    @BeforeEach
    void parse() {
        out = extractor.extract(Fixtures.html("profile.html"), "nasa");
    }

    private RawFields post(String id) {
        return out.getPosts().stream()
                .filter(p -> p.get(RawFields.POST_ID).orElse("").equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("post " + id + " not extracted"));
    }

    @Test
    void profile_fields_are_read_from_tagged_containers() {
        RawFields p = out.getProfile();
        assertThat(p.get(RawFields.USERNAME)).contains("NASA");
        assertThat(p.get(RawFields.DISPLAY_NAME)).contains("NASA");
        assertThat(p.get(RawFields.BIO)).contains("Exploring the universe and our home planet.");
        assertThat(p.get(RawFields.LOCATION)).contains("Pale Blue Dot");
        assertThat(p.get(RawFields.WEBSITE_URL)).contains("https://t.co/abc123");
        assertThat(p.get(RawFields.JOINED_DATE_RAW)).contains("Joined December 2007");
        assertThat(p.get(RawFields.FOLLOWERS_RAW)).contains("84.1M");
        assertThat(p.get(RawFields.FOLLOWING_RAW)).contains("180");
        assertThat(p.get(RawFields.POSTS_COUNT_RAW)).contains("1,234");
        assertThat(p.flag(RawFields.VERIFIED)).isTrue();
        assertThat(out.getErrors()).isEmpty();
    }

    @Test
    void posts_keep_page_order_and_drop_id_less_containers() {
        List<String> ids = out.getPosts().stream()
                .map(p -> p.get(RawFields.POST_ID).orElseThrow())
                .collect(Collectors.toList());
        assertThat(ids).containsExactly("1001", "1002", "1003", "1004", "1005");
    }

    @Test
    void exactly_one_post_is_pinned() {
        assertThat(out.getPosts()).filteredOn(p -> p.flag(RawFields.PINNED)).hasSize(1);
        assertThat(post("1001").flag(RawFields.PINNED)).isTrue();
    }

    @Test
    void plain_post_fields() {
        RawFields p = post("1001");
        assertThat(p.get(RawFields.POST_URL)).contains("https://x.com/NASA/status/1001");
        assertThat(p.get(RawFields.TEXT)).contains("Artemis II is go for launch.");
        assertThat(p.get(RawFields.REPLY_COUNT_RAW)).contains("1.2K");      // aria-label
        assertThat(p.get(RawFields.REPOST_COUNT_RAW)).contains("3,400");
        assertThat(p.get(RawFields.LIKE_COUNT_RAW)).contains("25K");        // aria 에 숫자 없음 → span
        assertThat(p.get(RawFields.VIEW_COUNT_RAW)).contains("1.5M");
        assertThat(p.get(RawFields.CREATED_AT_RAW)).contains("2026-01-18T18:17:20.000Z");
        assertThat(p.getAll(RawFields.MEDIA_URLS)).containsExactly("https://pbs.twimg.com/media/ABC.jpg?format=jpg");
        assertThat(p.has(RawFields.REPLY_TO)).isFalse();
        assertThat(p.has(RawFields.QUOTED_ID)).isFalse();
        assertThat(p.has(RawFields.REPOST_SOURCE)).isFalse();
    }

    @Test
    void reply_is_detected_from_replying_to_link() {
        RawFields p = post("1002");
        assertThat(p.get(RawFields.REPLY_TO)).contains("bob_astro");
        assertThat(p.get(RawFields.REPOST_COUNT_RAW)).contains("0");
        assertThat(p.has(RawFields.VIEW_COUNT_RAW)).isFalse();
    }

    @Test
    void quote_is_detected_from_quote_container() {
        RawFields p = post("1003");
        assertThat(p.get(RawFields.QUOTED_ID)).contains("2001");
        assertThat(p.get(RawFields.REPLY_COUNT_RAW)).contains("7");
        assertThat(p.get(RawFields.REPOST_COUNT_RAW)).contains("10");   // unretweet
        assertThat(p.get(RawFields.LIKE_COUNT_RAW)).contains("100");    // unlike
    }

    @Test
    void repost_source_skips_the_reposter_link() {
        RawFields p = post("1004");
        assertThat(p.get(RawFields.REPOST_SOURCE)).contains("dave");
        assertThat(p.get(RawFields.POST_URL)).contains("https://x.com/dave/status/1004");
    }

    @Test
    void relative_time_is_passed_through_raw() {
        assertThat(post("1005").get(RawFields.CREATED_AT_RAW)).contains("3h");
    }

    @Test
    void missing_identity_block_falls_back_to_requested_identity() {
        ExtractionOutcome o = extractor.extract(Fixtures.html("no_identity.html"), "ghost");
        assertThat(o.getProfile().get(RawFields.USERNAME)).contains("ghost");
        assertThat(o.getProfile().get(RawFields.DISPLAY_NAME)).contains("ghost");
        assertThat(o.getProfile().flag(RawFields.VERIFIED)).isFalse();
        assertThat(o.getPosts()).hasSize(1);
    }

    @Test
    void missing_identity_block_with_blank_identity_emits_no_username() {
        ExtractionOutcome o = extractor.extract(Fixtures.html("no_identity.html"), " ");
        assertThat(o.getProfile().has(RawFields.USERNAME)).isFalse();
    }

    @Test
    void display_name_includes_nested_span_text() {
        String html = "<div data-testid=\"UserName\"><span>Jane <span>Doe</span></span><span>@jd</span></div>";
        ExtractionOutcome o = extractor.extract(html, "jd");
        assertThat(o.getProfile().get(RawFields.DISPLAY_NAME)).contains("Jane Doe");
        assertThat(o.getProfile().get(RawFields.USERNAME)).contains("jd");
    }

    @Test
    void handle_falls_back_to_requested_identity() {
        ExtractionOutcome o = extractor.extract(Fixtures.html("handle_missing.html"), "janedoe");
        assertThat(o.getProfile().get(RawFields.USERNAME)).contains("janedoe");
        assertThat(o.getProfile().get(RawFields.DISPLAY_NAME)).contains("Jane Doe");
        assertThat(o.getProfile().get(RawFields.FOLLOWERS_RAW)).contains("2,048");   // /followers 폴백
        assertThat(o.getProfile().flag(RawFields.VERIFIED)).isFalse();
    }

    @Test
    void display_name_defaults_to_handle() {
        String html = "<div data-testid=\"UserName\"><span>@solo</span></div>";
        ExtractionOutcome o = extractor.extract(html, "solo");
        assertThat(o.getProfile().get(RawFields.DISPLAY_NAME)).contains("solo");
    }

    @Test
    void last_pinned_marker_wins() {
        String html = "<div>"
                + "<article data-testid=\"tweet\"><span>Pinned</span><a href=\"/a/status/11\">t</a></article>"
                + "<article data-testid=\"tweet\"><span>Pinned</span><a href=\"/a/status/22\">t</a></article>"
                + "</div>";
        Document doc = Jsoup.parse(html);
        assertThat(PinnedPostLocator.find(doc)).contains("22");

        ExtractionOutcome o = extractor.extract(doc, "a");
        assertThat(o.getPosts()).filteredOn(p -> p.flag(RawFields.PINNED))
                .extracting(p -> p.get(RawFields.POST_ID).orElseThrow())
                .containsExactly("22");
    }

    @Test
    void duplicated_pinned_id_marks_only_first_occurrence() {
        String html = "<article data-testid=\"tweet\"><span>Pinned</span><a href=\"/a/status/7\">t</a></article>"
                + "<article data-testid=\"tweet\"><a href=\"/a/status/7\">t</a></article>";
        ExtractionOutcome o = extractor.extract(html, "a");
        assertThat(o.getPosts()).hasSize(2);
        assertThat(o.getPosts()).filteredOn(p -> p.flag(RawFields.PINNED)).hasSize(1);
    }

    @Test
    void reply_falls_back_to_social_context() {
        String html = "<article data-testid=\"tweet\">"
                + "<div data-testid=\"socialContext\">Replying to @carol and others</div>"
                + "<a href=\"/a/status/9\">t</a></article>";
        ExtractionOutcome o = extractor.extract(html, "a");
        assertThat(o.getPosts().get(0).get(RawFields.REPLY_TO)).contains("carol");
    }

    @Test
    void quote_falls_back_to_card_wrapper() {
        String html = "<article data-testid=\"tweet\"><a href=\"/a/status/9\">t</a>"
                + "<div data-testid=\"card.wrapper\"><a href=\"/b/status/abc\">x</a><a href=\"/b/status/77\">y</a></div>"
                + "</article>";
        ExtractionOutcome o = extractor.extract(html, "a");
        assertThat(o.getPosts().get(0).get(RawFields.QUOTED_ID)).contains("77");
    }

    @Test
    void custom_base_url_is_used_for_relative_links() {
        JsoupPageExtractor local = new JsoupPageExtractor("http://localhost:8080/");
        ExtractionOutcome o = local.extract("<article data-testid=\"tweet\"><a href=\"/a/status/5?x=1\">t</a></article>", "a");
        assertThat(o.getPosts().get(0).get(RawFields.POST_URL)).contains("http://localhost:8080/a/status/5");
    }

    @Test
    void empty_html_yields_empty_outcome() {
        ExtractionOutcome o = extractor.extract("", "nobody");
        assertThat(o.getProfile().isEmpty()).isTrue();
        assertThat(o.getPosts()).isEmpty();
        assertThat(o.getErrors()).isEmpty();
    }
}

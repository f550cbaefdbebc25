package com.xingest.core.extract;

import com.xingest.core.model.ExtractionOutcome;
import com.xingest.core.model.RawFields;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * jsoup 기반 기본 추출기.
 * 프로필/포스트 두 단계를 각각 격리한다: 한 단계가 터지면 그 단계 출력만 비우고 에러 문자열을 남긴다.
 */
public class JsoupPageExtractor implements PageExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(JsoupPageExtractor.class);

    public static final String DEFAULT_BASE_URL = "https://x.com";

    private final String baseUrl;
    private final ProfileFieldExtractor profiles = new ProfileFieldExtractor();
    private final PostFieldExtractor posts;

    public JsoupPageExtractor() {
        this(DEFAULT_BASE_URL);
    }

    /** baseUrl: 상대 status 링크를 절대 URL 로 만들 때 사용 */
    public JsoupPageExtractor(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl").replaceAll("/+$", "");
        this.posts = new PostFieldExtractor(this.baseUrl);
    }

    @Override
    public ExtractionOutcome extract(String html, String identity) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUrl);
        return extract(doc, identity);
    }

    public ExtractionOutcome extract(Document doc, String identity) {
        List<String> errors = new ArrayList<>();

        RawFields profile;
        try {
            profile = profiles.extract(doc, identity);
        } catch (RuntimeException e) {
            LOG.warn("profile extraction failed for {}: {}", identity, e.toString());
            profile = new RawFields();
            errors.add("Profile extraction error: " + e.getMessage());
        }

        List<RawFields> postList;
        try {
            String pinnedId = PinnedPostLocator.find(doc).orElse(null);
            postList = posts.extractAll(doc, pinnedId);
        } catch (RuntimeException e) {
            LOG.warn("post extraction failed for {}: {}", identity, e.toString());
            postList = List.of();
            errors.add("Post extraction error: " + e.getMessage());
        }

        LOG.debug("extracted {} posts for {} ({} errors)", postList.size(), identity, errors.size());
        return new ExtractionOutcome(profile, postList, errors);
    }

    public String getBaseUrl() { return baseUrl; }
}

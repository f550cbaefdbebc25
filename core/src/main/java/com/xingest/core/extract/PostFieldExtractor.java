package com.xingest.core.extract;

import com.xingest.core.model.RawFields;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** 타임라인 포스트 컨테이너 → RawFields 목록(문서 순서 유지) */
final class PostFieldExtractor {

    private static final Pattern METRIC_TOKEN = Pattern.compile("^[\\d.,]+[KMBkmb]?$");

    private final String baseUrl;

    PostFieldExtractor(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    List<RawFields> extractAll(Document doc, String pinnedId) {
        List<RawFields> out = new ArrayList<>();
        String pending = pinnedId; // 같은 ID 가 두 번 나와도 고정 표시는 한 번만
        for (Element post : doc.select(Selectors.POST)) {
            RawFields f = extractOne(post, pending);
            if (f == null) continue;
            if (f.flag(RawFields.PINNED)) pending = null;
            out.add(f);
        }
        return out;
    }

    /** ID 없는 포스트는 null (조용히 버림) */
    RawFields extractOne(Element post, String pinnedId) {
        Element link = StatusLinks.firstStatusLink(post).orElse(null);
        if (link == null) return null;
        String href = link.attr("href");
        String id = StatusLinks.idOf(href).orElse(null);
        if (id == null) return null;

        RawFields f = new RawFields();
        f.put(RawFields.POST_ID, id);
        f.put(RawFields.POST_URL, StatusLinks.canonicalUrl(href, baseUrl));
        f.putFlag(RawFields.PINNED, id.equals(pinnedId));

        Element text = post.selectFirst(Selectors.POST_TEXT);
        f.put(RawFields.TEXT, text != null ? text.text() : "");

        f.put(RawFields.REPLY_COUNT_RAW, metric(post.selectFirst(Selectors.REPLY_BUTTON)));
        f.put(RawFields.REPOST_COUNT_RAW, metric(post.selectFirst(Selectors.REPOST_BUTTON)));
        f.put(RawFields.LIKE_COUNT_RAW, metric(post.selectFirst(Selectors.LIKE_BUTTON)));

        Element views = post.selectFirst(Selectors.VIEWS_LINK);
        if (views != null && !views.text().isBlank()) f.put(RawFields.VIEW_COUNT_RAW, views.text().trim());

        Element time = post.selectFirst(Selectors.TIME);
        if (time != null) f.put(RawFields.CREATED_AT_RAW, time.attr("datetime"));

        for (Element img : post.select(Selectors.MEDIA_IMG)) {
            String src = img.attr("src");
            if (!src.isBlank()) f.add(RawFields.MEDIA_URLS, src);
        }

        RelationshipDetector.replyTarget(post).ifPresent(u -> f.put(RawFields.REPLY_TO, u));
        RelationshipDetector.repostSource(post).ifPresent(u -> f.put(RawFields.REPOST_SOURCE, u));
        RelationshipDetector.quotedId(post).ifPresent(q -> f.put(RawFields.QUOTED_ID, q));
        return f;
    }

    /** aria-label 첫 토큰("1.2K Likes") → 중첩 span 텍스트 → "0" */
    static String metric(Element control) {
        if (control == null) return null;
        String aria = control.attr("aria-label").trim();
        if (!aria.isEmpty()) {
            String first = aria.split("\\s+")[0];
            if (METRIC_TOKEN.matcher(first).matches()) return first;
        }
        Element span = control.selectFirst("span");
        if (span != null && !span.text().isBlank()) return span.text().trim();
        return "0";
    }
}

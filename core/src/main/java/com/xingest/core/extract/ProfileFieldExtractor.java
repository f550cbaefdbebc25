package com.xingest.core.extract;

import com.xingest.core.model.RawFields;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 프로필 헤더 영역 → RawFields (문자열 그대로, 변환 없음) */
final class ProfileFieldExtractor {

    private static final Pattern POSTS_HEADER =
            Pattern.compile("^([\\d.,]+\\s?[KMBkmb]?)\\s+(posts|tweets)$", Pattern.CASE_INSENSITIVE);

    RawFields extract(Document doc, String identity) {
        RawFields out = new RawFields();

        Element block = doc.selectFirst(Selectors.USER_NAME);
        if (block != null) {
            readIdentityBlock(block, identity, out);
        } else if (identity != null && !identity.isBlank()) {
            // 블록이 없으면 요청 identity 로 채운다
            out.put(RawFields.USERNAME, identity);
            out.put(RawFields.DISPLAY_NAME, identity);
            out.putFlag(RawFields.VERIFIED, false);
        }

        Element bio = doc.selectFirst(Selectors.USER_DESCRIPTION);
        if (bio != null) out.put(RawFields.BIO, bio.text());

        Element joined = doc.selectFirst(Selectors.USER_JOIN_DATE);
        if (joined != null) out.put(RawFields.JOINED_DATE_RAW, joined.text());

        Element site = doc.selectFirst(Selectors.USER_URL + " a[href], a" + Selectors.USER_URL + "[href]");
        if (site != null && !site.attr("href").isBlank()) out.put(RawFields.WEBSITE_URL, site.attr("href"));

        Element location = doc.selectFirst(Selectors.USER_LOCATION);
        if (location != null && !location.text().isBlank()) out.put(RawFields.LOCATION, location.text());

        Element followers = doc.selectFirst(Selectors.FOLLOWERS_LINK);
        if (followers == null) followers = doc.selectFirst(Selectors.FOLLOWERS_LINK_FALLBACK);
        if (followers != null) out.put(RawFields.FOLLOWERS_RAW, leadingCount(followers));

        Element following = doc.selectFirst(Selectors.FOLLOWING_LINK);
        if (following != null) out.put(RawFields.FOLLOWING_RAW, leadingCount(following));

        out.put(RawFields.POSTS_COUNT_RAW, postsHeader(doc));
        return out;
    }

    /** span 을 문서 순서로 훑는다: 첫 비-@ 텍스트 = 표시명, 첫 @ 텍스트 = 핸들. 중첩 span 텍스트 포함. */
    private static void readIdentityBlock(Element block, String identity, RawFields out) {
        String displayName = null;
        String handle = null;
        for (Element span : block.select("span")) {
            String t = span.text().trim();
            if (t.isEmpty()) continue;
            if (t.startsWith("@")) {
                if (handle == null && t.length() > 1) handle = t.substring(1);
            } else if (displayName == null) {
                displayName = t;
            }
            if (handle != null && displayName != null) break;
        }
        if (handle == null) handle = identity;
        if (handle == null || handle.isBlank()) return;

        out.put(RawFields.USERNAME, handle);
        out.put(RawFields.DISPLAY_NAME, displayName != null ? displayName : handle);
        out.putFlag(RawFields.VERIFIED, block.selectFirst(Selectors.VERIFIED_ICON) != null);
    }

    /** 링크 안 첫 span 텍스트, 없으면 링크 텍스트 첫 토큰 */
    private static String leadingCount(Element link) {
        for (Element span : link.select("span")) {
            String t = span.text().trim();
            if (!t.isEmpty()) return t.split("\\s+")[0];
        }
        String t = link.text().trim();
        return t.isEmpty() ? null : t.split("\\s+")[0];
    }

    /** "12.3K posts" 헤더. 포스트 본문 안의 문구는 제외. */
    private static String postsHeader(Document doc) {
        for (Element e : doc.getElementsMatchingOwnText(POSTS_HEADER)) {
            if (e.closest(Selectors.POST) != null) continue;
            Matcher m = POSTS_HEADER.matcher(e.ownText().trim());
            if (m.matches()) return m.group(1);
        }
        return null;
    }
}

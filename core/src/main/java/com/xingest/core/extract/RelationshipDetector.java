package com.xingest.core.extract;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** reply / repost / quote 판별. 세 휴리스틱은 서로 독립적이다. */
final class RelationshipDetector {
    private RelationshipDetector() {}

    private static final Pattern MENTION = Pattern.compile("@(\\w+)");

    /** "Replying to @x" → x */
    static Optional<String> replyTarget(Element post) {
        for (Element marker : post.getElementsContainingOwnText(Selectors.REPLYING_TO)) {
            Optional<String> near = mentionLink(marker);
            if (near.isEmpty() && marker.parent() != null) near = mentionLink(marker.parent());
            if (near.isPresent()) return near;
        }
        Element ctx = post.selectFirst(Selectors.SOCIAL_CONTEXT);
        if (ctx != null && ctx.text().contains(Selectors.REPLYING_TO)) {
            Matcher m = MENTION.matcher(ctx.text());
            if (m.find()) return Optional.of(m.group(1));
        }
        return Optional.empty();
    }

    private static Optional<String> mentionLink(Element scope) {
        for (Element a : scope.select("a[href^=/]")) {
            String t = a.text().trim();
            if (t.startsWith("@") && t.length() > 1) return Optional.of(t.substring(1));
        }
        return Optional.empty();
    }

    /**
     * "X reposted" 컨텍스트가 있으면 첫 단일 세그먼트 사용자 링크가 원작성자.
     * 컨텍스트 라벨을 감싸는 링크(리포스트한 쪽)는 건너뛴다.
     */
    static Optional<String> repostSource(Element post) {
        Element ctx = post.selectFirst(Selectors.SOCIAL_CONTEXT);
        if (ctx == null) return Optional.empty();
        String label = ctx.text().toLowerCase(Locale.ROOT);
        if (!label.contains("reposted") && !label.contains("retweeted")) return Optional.empty();

        for (Element a : post.select(Selectors.USER_LINK)) {
            if (a == ctx || ctx.parents().contains(a) || a.parents().contains(ctx)) continue;
            String href = a.attr("href");
            if (href.contains("/status/")) continue;
            String user = href.substring(1);
            int q = user.indexOf('?');
            if (q >= 0) user = user.substring(0, q);
            if (user.isEmpty() || user.contains("/")) continue;
            return Optional.of(user);
        }
        return Optional.empty();
    }

    /** quoteTweet 컨테이너, 없으면 card.wrapper 안의 첫 status 링크 */
    static Optional<String> quotedId(Element post) {
        Element quote = post.selectFirst(Selectors.QUOTE_CONTAINER);
        if (quote != null) {
            Optional<String> id = StatusLinks.firstStatusId(quote);
            if (id.isPresent()) return id;
        }
        for (Element card : post.select(Selectors.CARD_WRAPPER)) {
            Optional<String> id = StatusLinks.firstStatusId(card);
            if (id.isPresent()) return id;
        }
        return Optional.empty();
    }
}

package com.xingest.core.extract;

import org.jsoup.nodes.Element;

import java.util.Optional;

/** "/user/status/123?x=1" 형태 링크에서 숫자 포스트 ID 추출 */
final class StatusLinks {
    private StatusLinks() {}

    private static final String MARK = "/status/";

    static Optional<String> idOf(String href) {
        if (href == null) return Optional.empty();
        int i = href.indexOf(MARK);
        if (i < 0) return Optional.empty();
        String rest = href.substring(i + MARK.length());
        int cut = indexOfAny(rest, '/', '?', '#');
        String id = (cut < 0 ? rest : rest.substring(0, cut));
        if (id.isEmpty() || !id.chars().allMatch(Character::isDigit)) return Optional.empty();
        return Optional.of(id);
    }

    /** scope 안의 첫 번째 유효 status 링크 */
    static Optional<Element> firstStatusLink(Element scope) {
        for (Element a : scope.select(Selectors.STATUS_LINK)) {
            if (idOf(a.attr("href")).isPresent()) return Optional.of(a);
        }
        return Optional.empty();
    }

    static Optional<String> firstStatusId(Element scope) {
        return firstStatusLink(scope).flatMap(a -> idOf(a.attr("href")));
    }

    /** 쿼리 제거 후 절대 URL 로. 상대 경로면 baseUrl 을 붙인다. */
    static String canonicalUrl(String href, String baseUrl) {
        int q = indexOfAny(href, '?', '#');
        String path = (q < 0 ? href : href.substring(0, q));
        if (path.startsWith("http://") || path.startsWith("https://")) return path;
        return baseUrl + (path.startsWith("/") ? path : "/" + path);
    }

    private static int indexOfAny(String s, char... cs) {
        int best = -1;
        for (char c : cs) {
            int i = s.indexOf(c);
            if (i >= 0 && (best < 0 || i < best)) best = i;
        }
        return best;
    }
}

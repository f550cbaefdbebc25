package com.xingest.core.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.Optional;

/**
 * "Pinned" 라벨 → 고정 포스트 ID.
 * 라벨에서 최대 PINNED_MAX_DEPTH 단계 조상까지 올라가며 포스트 컨테이너를 찾는다.
 * 라벨이 여러 개면 각각 독립적으로 해석하고 마지막 것이 이긴다.
 */
final class PinnedPostLocator {
    private PinnedPostLocator() {}

    static Optional<String> find(Document doc) {
        String pinned = null;
        for (Element e : doc.getAllElements()) {
            for (TextNode tn : e.textNodes()) {
                if (!Selectors.PINNED_MARKER.equals(tn.text().trim())) continue;
                String id = resolve(e);
                if (id != null) pinned = id;
            }
        }
        return Optional.ofNullable(pinned);
    }

    private static String resolve(Element from) {
        Element cur = from;
        for (int depth = 0; depth < Selectors.PINNED_MAX_DEPTH && cur != null; depth++) {
            Element post = cur.selectFirst(Selectors.POST); // 자기 자신 포함
            if (post != null) {
                return StatusLinks.firstStatusId(post).orElse(null);
            }
            cur = cur.parent();
        }
        return null;
    }
}

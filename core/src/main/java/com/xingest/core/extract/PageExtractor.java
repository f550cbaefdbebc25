package com.xingest.core.extract;

import com.xingest.core.model.ExtractionOutcome;

/** 렌더된 프로필 페이지에서 프로필/포스트 원시 필드를 뽑아내는 전략 인터페이스. */
public interface PageExtractor {
    /**
     * html 을 파싱해 원시 필드 맵을 만든다.
     * 단계별 실패는 예외로 새지 않고 ExtractionOutcome.errors 에 문자열로 남는다.
     */
    ExtractionOutcome extract(String html, String identity);
}

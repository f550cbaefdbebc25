package com.xingest.core.fetch;

/**
 * identity → 렌더된 프로필 HTML.
 * 구현체는 타임아웃/취소를 스스로 처리하고, 재시도하지 않는다.
 * 실패는 가능한 한 예외 대신 FetchResult.fail 로 돌려준다.
 */
public interface PageFetcher {
    FetchResult fetch(String identity, FetchOptions options);
}

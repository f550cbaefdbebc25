package com.xingest.core.model;

/** 페이지 페치 실패 분류. 외부 레이어(HTTP)는 NOT_FOUND→404, BLOCKED→403/429 로 매핑한다. */
public enum FetchFailure {
    NOT_FOUND,
    BLOCKED,
    HTTP_ERROR,
    TIMEOUT,
    TRANSPORT,
    NO_RESPONSE,
    GENERIC;

    /** HTTP 상태코드 → 분류. 400 미만이면 null */
    public static FetchFailure fromStatus(int status) {
        if (status == 404) return NOT_FOUND;
        if (status == 403 || status == 429) return BLOCKED;
        if (status >= 400) return HTTP_ERROR;
        return null;
    }
}

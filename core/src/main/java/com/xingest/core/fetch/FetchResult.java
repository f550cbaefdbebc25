package com.xingest.core.fetch;

import com.xingest.core.model.FetchFailure;

import java.util.Optional;

public final class FetchResult {
    public final boolean success;
    public final String html;                   // 실패 시 ""
    public final Integer status;                // HTTP 상태(응답이 없었으면 null)
    public final Optional<String> error;        // 실패 사유
    public final Optional<FetchFailure> failure;

    public FetchResult(boolean success, String html, Integer status, String error, FetchFailure failure) {
        this.success = success;
        this.html = (html == null ? "" : html);
        this.status = status;
        this.error = Optional.ofNullable(error);
        this.failure = Optional.ofNullable(failure);
    }

    public static FetchResult ok(String html, Integer status) {
        return new FetchResult(true, html, status, null, null);
    }

    public static FetchResult fail(String error, FetchFailure failure) {
        return new FetchResult(false, "", null, error, failure);
    }

    public static FetchResult fail(String error, FetchFailure failure, Integer status) {
        return new FetchResult(false, "", status, error, failure);
    }

    @Override public String toString() {
        return success
                ? "FetchResult{ok, status=" + status + ", html=" + html.length() + " chars}"
                : "FetchResult{fail, " + failure.orElse(null) + ", " + error.orElse("") + "}";
    }
}

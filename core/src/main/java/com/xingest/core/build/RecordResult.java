package com.xingest.core.build;

import java.util.Optional;

/** 레코드 1건 변환 결과: 값 또는 에러 문자열 중 하나 */
public final class RecordResult<T> {
    private final T value;
    private final String error;

    private RecordResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> RecordResult<T> ok(T value) { return new RecordResult<>(value, null); }
    public static <T> RecordResult<T> failed(String error) { return new RecordResult<>(null, error); }

    public boolean isOk() { return error == null; }
    public Optional<T> value() { return Optional.ofNullable(value); }
    public Optional<String> error() { return Optional.ofNullable(error); }
}

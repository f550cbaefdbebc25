package com.xingest.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 추출기 → RecordBuilder 사이의 중간 구조.
 * 문자열 키 → 선택적 문자열 값(+ 다중값 리스트). 타입 변환은 RecordBuilder에서만 한다.
 */
public final class RawFields {

    // ---------- 프로필 키 ----------
    public static final String USERNAME = "username";
    public static final String DISPLAY_NAME = "display_name";
    public static final String BIO = "bio";
    public static final String WEBSITE_URL = "website_url";
    public static final String LOCATION = "location";
    public static final String JOINED_DATE_RAW = "joined_date_raw";
    public static final String FOLLOWERS_RAW = "followers_count_raw";
    public static final String FOLLOWING_RAW = "following_count_raw";
    public static final String POSTS_COUNT_RAW = "posts_count_raw";
    public static final String VERIFIED = "is_verified";

    // ---------- 포스트 키 ----------
    public static final String POST_ID = "post_id";
    public static final String POST_URL = "post_url";
    public static final String TEXT = "text";
    public static final String PINNED = "is_pinned";
    public static final String REPLY_COUNT_RAW = "reply_count_raw";
    public static final String REPOST_COUNT_RAW = "repost_count_raw";
    public static final String LIKE_COUNT_RAW = "like_count_raw";
    public static final String VIEW_COUNT_RAW = "view_count_raw";
    public static final String CREATED_AT_RAW = "created_at_raw";
    public static final String MEDIA_URLS = "media_urls";
    public static final String REPLY_TO = "reply_to_username";
    public static final String QUOTED_ID = "quoted_post_id";
    public static final String REPOST_SOURCE = "repost_source";

    private final Map<String, String> values = new LinkedHashMap<>();
    private final Map<String, List<String>> lists = new LinkedHashMap<>();

    /** null 값은 저장하지 않는다(키 부재와 동일 취급). */
    public RawFields put(String key, String value) {
        if (value != null) values.put(key, value);
        return this;
    }

    public RawFields putFlag(String key, boolean flag) {
        values.put(key, Boolean.toString(flag));
        return this;
    }

    public RawFields add(String key, String value) {
        if (value != null) lists.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getOrDefault(String key, String fallback) {
        return values.getOrDefault(key, fallback);
    }

    public boolean flag(String key) {
        return Boolean.parseBoolean(values.get(key));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public List<String> getAll(String key) {
        List<String> l = lists.get(key);
        return l == null ? List.of() : Collections.unmodifiableList(l);
    }

    public boolean isEmpty() {
        return values.isEmpty() && lists.isEmpty();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "RawFields" + values + (lists.isEmpty() ? "" : " " + lists);
    }
}

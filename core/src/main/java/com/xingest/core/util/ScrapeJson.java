package com.xingest.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** 캐시/내보내기 공용 ObjectMapper. 날짜는 ISO-8601 문자열. */
public final class ScrapeJson {
    private ScrapeJson() {}

    private static final ObjectMapper MAPPER = newMapper();

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** 공유 인스턴스(설정 변경 금지) */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}

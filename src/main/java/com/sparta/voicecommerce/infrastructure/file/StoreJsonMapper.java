package com.sparta.voicecommerce.infrastructure.file;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 카탈로그/원장 파일 전용 ObjectMapper
 * REST 응답용 매퍼와 설정을 공유하지 않는다
 */
public final class StoreJsonMapper {

    private StoreJsonMapper() {
        throw new AssertionError("StoreJsonMapper는 인스턴스화할 수 없습니다");
    }

    public static ObjectMapper create() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }
}

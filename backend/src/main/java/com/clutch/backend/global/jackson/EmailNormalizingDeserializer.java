package com.clutch.backend.global.jackson;

import java.io.IOException;

import com.clutch.backend.auth.support.EmailNormalizer;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 이메일 입력을 EmailNormalizer 규칙(trim + 소문자)으로 맞추는 역직렬화기.
 * - null은 그대로 null (필수 여부는 @NotBlank가 판단)
 */
public class EmailNormalizingDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String v = p.getValueAsString();
        return v == null ? null : EmailNormalizer.normalize(v);
    }
}

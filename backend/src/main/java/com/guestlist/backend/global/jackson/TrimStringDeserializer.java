package com.guestlist.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

/**
 * 요청 DTO 문자열 필드용: 앞뒤 공백 제거 ("  Anna  " -> "Anna")
 *
 * - 공백뿐이면 빈 문자열이 되어 @NotBlank에서 걸린다.
 * - 문자열이 아닌 값({"email": 123}, 배열, 객체)은 받지 않는다 -> 400 VALIDATION_ERROR
 */
public class TrimStringDeserializer extends StdScalarDeserializer<String> {

    public TrimStringDeserializer() {
        super(String.class);
    }

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            return (String) ctxt.handleUnexpectedToken(String.class, p);
        }
        return p.getText().trim();
    }
}

package com.vidforge.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 씬 품질 분석 결과 권고
 */
@Getter
@RequiredArgsConstructor
public enum Recommendation {

    APPROVE("approve"),
    NEEDS_REVIEW("needs_review"),
    REJECT("reject"),
    PENDING("pending");

    @JsonValue
    private final String code;

    /**
     * 분석 서비스는 "regenerate" 를 반환하기도 하는데, 게이트 입장에서는 reject 와 같다.
     */
    @JsonCreator
    public static Recommendation fromCode(String code) {
        if (code == null) {
            return PENDING;
        }
        if ("regenerate".equalsIgnoreCase(code)) {
            return REJECT;
        }
        for (Recommendation r : values()) {
            if (r.code.equalsIgnoreCase(code)) {
                return r;
            }
        }
        return PENDING;
    }
}

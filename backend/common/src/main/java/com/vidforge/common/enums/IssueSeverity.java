package com.vidforge.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum IssueSeverity {

    CRITICAL("critical"),
    MAJOR("major"),
    MINOR("minor");

    @JsonValue
    private final String code;

    @JsonCreator
    public static IssueSeverity fromCode(String code) {
        for (IssueSeverity s : values()) {
            if (s.code.equalsIgnoreCase(code)) {
                return s;
            }
        }
        // 알 수 없는 심각도는 minor 로 취급
        return MINOR;
    }
}

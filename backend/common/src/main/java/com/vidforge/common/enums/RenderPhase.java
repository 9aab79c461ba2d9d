package com.vidforge.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 청크 렌더 진행 단계 (UI 표시용)
 */
@Getter
@RequiredArgsConstructor
public enum RenderPhase {

    PREPARING("preparing", "청크 계산중"),
    RENDERING("rendering", "청크 렌더링중"),
    DOWNLOADING("downloading", "청크 다운로드중"),
    CONCATENATING("concatenating", "청크 병합중"),
    UPLOADING("uploading", "최종 영상 업로드중"),
    COMPLETE("complete", "완료"),
    ERROR("error", "실패");

    @JsonValue
    private final String code;
    private final String description;
}

package com.vidforge.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * 렌더 작업(Job) 상태
 *
 * queued → generating → awaiting_render → render_queued → lambda_pending → rendering → complete
 * 어느 활성 상태에서든 복구 불가능한 오류 발생 시 error 로 전이된다.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    QUEUED("queued", "에셋 생성 대기"),
    GENERATING("generating", "에셋 생성중"),
    AWAITING_RENDER("awaiting_render", "렌더 요청 대기"),
    RENDER_QUEUED("render_queued", "렌더 대기"),
    LAMBDA_PENDING("lambda_pending", "렌더 청크 디스패치중"),
    RENDERING("rendering", "렌더링중"),
    COMPLETE("complete", "완료"),
    ERROR("error", "실패");

    /**
     * 이전 프로세스가 죽었을 때 원격 렌더가 진행중이었을 수 있는 상태
     */
    public static final Set<JobStatus> RENDER_ACTIVE = EnumSet.of(LAMBDA_PENDING, RENDERING);

    @JsonValue
    private final String code;
    private final String description;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    public boolean isRenderActive() {
        return RENDER_ACTIVE.contains(this);
    }

    @JsonCreator
    public static JobStatus fromCode(String code) {
        for (JobStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + code);
    }
}

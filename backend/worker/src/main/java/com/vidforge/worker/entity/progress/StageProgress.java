package com.vidforge.worker.entity.progress;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 파이프라인 단계별 진행 기록의 공통 부모
 * JSON 에는 "stage" 태그가 붙으며, 읽을 때 선언된 단계와 태그가 다르면 실패한다.
 */
@Getter
@Setter
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "stage")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GenerationStage.class, name = "generation"),
        @JsonSubTypes.Type(value = RenderStage.class, name = "render")
})
public abstract class StageProgress {
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}

package com.vidforge.worker.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

/**
 * 렌더 설정
 * compositionId 가 없으면 렌더를 시작할 수 없다 (치명적 오류).
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderConfig {
    private String compositionId;
    private String serveUrl;
    private Integer fps;
    private Integer width;
    private Integer height;
    private Map<String, Object> inputProps;   // 컴포지션 기본 입력값

    public boolean hasComposition() {
        return compositionId != null && !compositionId.isBlank();
    }
}

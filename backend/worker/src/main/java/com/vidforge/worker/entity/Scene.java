package com.vidforge.worker.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 장면
 * 렌더가 시작된 이후에는 analysis 외의 필드를 변경하지 않는다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Scene {
    private String sceneId;
    private Integer sceneOrder;
    private String narration;         // 나레이션 텍스트
    private String visualDirection;   // 화면 연출 지시
    private Double durationSeconds;   // 장면 길이 (초)
    private SceneAssets assets;       // 생성된 에셋 참조
    private SceneAnalysis analysis;   // 품질 분석 결과 (선택)

    /**
     * 에셋이 이미 생성되었는지 (재시작 시 건너뛰기 판단)
     */
    public boolean hasAssets() {
        return assets != null && assets.hasAnyAsset();
    }

    public boolean hasAnalysis() {
        return analysis != null;
    }

    public double durationOrZero() {
        return durationSeconds != null ? durationSeconds : 0d;
    }
}

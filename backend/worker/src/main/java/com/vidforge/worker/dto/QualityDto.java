package com.vidforge.worker.dto;

import com.vidforge.common.enums.Recommendation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class QualityDto {

    /**
     * 렌더 게이트 판정
     * allowed 는 blockingReasons 가 비어 있을 때만 true
     */
    @Getter
    public static class GateVerdict {
        private final boolean allowed;
        private final List<String> blockingReasons;

        public GateVerdict(List<String> blockingReasons) {
            this.blockingReasons = List.copyOf(blockingReasons);
            this.allowed = this.blockingReasons.isEmpty();
        }
    }

    @Getter
    @Builder
    @AllArgsConstructor
    public static class SceneQuality {
        private String sceneId;
        private Integer score;
        private Recommendation status;
        private long criticalIssues;
        private long majorIssues;
        private long minorIssues;
    }

    /**
     * 작업 품질 리포트 (저장하지 않고 요청 시 계산)
     */
    @Getter
    @Builder
    @AllArgsConstructor
    public static class QualityReport {
        private String jobId;
        private List<SceneQuality> scenes;
        private Integer aggregateScore;
        private int minimumProjectScore;
        private Recommendation recommendation;
        private long criticalIssues;
        private long majorIssues;
        private long minorIssues;
        private int approvedScenes;
        private int needsReviewScenes;
        private int rejectedScenes;
        private int pendingScenes;
        private List<String> blockingReasons;
        private boolean canRender;
    }
}

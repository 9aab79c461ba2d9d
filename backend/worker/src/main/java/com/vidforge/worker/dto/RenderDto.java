package com.vidforge.worker.dto;

import com.vidforge.common.enums.ChunkExecutionStatus;
import com.vidforge.worker.entity.Scene;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;

public class RenderDto {

    /**
     * 작업 하나의 전체 렌더 요청
     */
    @Getter
    @Builder
    @AllArgsConstructor
    public static class RenderSpec {
        private String jobId;
        private String compositionId;
        private String serveUrl;
        private int fps;
        private Integer width;
        private Integer height;
        private Map<String, Object> inputProps;
        private List<Scene> scenes;
    }

    /**
     * 청크 분할 결과
     * endFrame 은 포함 구간 (inclusive)
     */
    @Getter
    @Builder
    @AllArgsConstructor
    public static class ChunkPlan {
        private int chunkIndex;
        private int startFrame;
        private int endFrame;
        private double startTimeSeconds;
        private double endTimeSeconds;
        private List<ChunkScene> scenes;

        public int frameCount() {
            return endFrame - startFrame + 1;
        }

        public double durationSeconds() {
            return endTimeSeconds - startTimeSeconds;
        }
    }

    @Getter
    @Builder
    @AllArgsConstructor
    public static class ChunkScene {
        private String sceneId;
        private int sceneIndex;           // 전체 씬 목록에서의 위치
        private int chunkStartFrame;      // 청크 내부 기준 시작 프레임
        private int durationInFrames;
    }

    /**
     * 원격 실행기로 보내는 청크 요청
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChunkSpec {
        private String jobId;
        private int chunkIndex;
        private int totalChunks;
        private String compositionId;
        private String serveUrl;
        private int fps;
        private Integer width;
        private Integer height;
        private int startFrame;
        private int endFrame;
        private Map<String, Object> inputProps;
        private String outName;
    }

    /**
     * 디스패치 결과 (원격 렌더 상관 키)
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RenderHandle {
        private String externalRenderId;
        private String externalStorageLocation;
    }

    /**
     * 청크 상태 조회 결과
     * percent: 0 ~ 100
     */
    @Getter
    @Setter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChunkStatusResult {
        private ChunkExecutionStatus status;
        private int percent;
        private String outputLocation;
        private String error;

        public static ChunkStatusResult inProgress(int percent) {
            return new ChunkStatusResult(ChunkExecutionStatus.IN_PROGRESS, percent, null, null);
        }

        public static ChunkStatusResult complete(String outputLocation) {
            return new ChunkStatusResult(ChunkExecutionStatus.COMPLETE, 100, outputLocation, null);
        }

        public static ChunkStatusResult failed(String error) {
            return new ChunkStatusResult(ChunkExecutionStatus.FAILED, 0, null, error);
        }

        public static ChunkStatusResult notFound() {
            return new ChunkStatusResult(ChunkExecutionStatus.NOT_FOUND, 0, null, "render not found");
        }
    }
}

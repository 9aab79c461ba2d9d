package com.vidforge.worker.service.render;

import com.vidforge.common.enums.RenderPhase;
import com.vidforge.worker.entity.progress.RenderStage;
import com.vidforge.worker.entity.progress.RenderStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * RenderStage → RenderStatus (UI 용 진행률)
 *
 * preparing 5, rendering 10~59, downloading 60~75, concatenating 80, uploading 90, complete 100
 */
@Component
@RequiredArgsConstructor
public class RenderStatusProjector {

    private static final int RENDER_START = 10;
    private static final int RENDER_SPAN = 50;
    private static final int RENDER_CAP = 59;
    private static final int DOWNLOAD_START = 60;
    private static final int DOWNLOAD_SPAN = 15;

    private final Clock clock;

    public RenderStatus preparing(RenderStage stage, String message) {
        return build(stage, RenderPhase.PREPARING, null, 5, message, null);
    }

    /**
     * @param chunkPercent 원격 실행기가 보고한 현재 청크 진행률 (0~100)
     */
    public RenderStatus rendering(RenderStage stage, int currentChunk, int chunkPercent) {
        int total = Math.max(1, stage.getTotalChunks());
        int completed = stage.completedChunkCount();
        double chunkShare = (double) RENDER_SPAN / total;
        int percent = (int) Math.floor(RENDER_START + completed * chunkShare
                + Math.max(0, Math.min(100, chunkPercent)) / 100.0 * chunkShare);
        percent = Math.min(RENDER_CAP, percent);
        String message = "Rendering chunk " + (currentChunk + 1) + " of " + total + " (" + chunkPercent + "%)";
        return build(stage, RenderPhase.RENDERING, currentChunk, percent, message, null);
    }

    public RenderStatus downloading(RenderStage stage, int chunkIndex) {
        int total = Math.max(1, stage.getTotalChunks());
        int percent = DOWNLOAD_START + (int) Math.floor((double) chunkIndex / total * DOWNLOAD_SPAN);
        return build(stage, RenderPhase.DOWNLOADING, chunkIndex, percent,
                "Downloading chunk " + (chunkIndex + 1) + " of " + total, null);
    }

    public RenderStatus concatenating(RenderStage stage) {
        return build(stage, RenderPhase.CONCATENATING, null, 80, "Concatenating " + stage.getTotalChunks() + " chunks", null);
    }

    public RenderStatus uploading(RenderStage stage) {
        return build(stage, RenderPhase.UPLOADING, null, 90, "Uploading final video", null);
    }

    public RenderStatus complete(RenderStage stage) {
        return build(stage, RenderPhase.COMPLETE, null, 100, "Render complete", null);
    }

    public RenderStatus error(RenderStage stage, Integer chunkIndex, String error) {
        int total = Math.max(1, stage.getTotalChunks());
        int percent = Math.min(RENDER_CAP, RENDER_START + stage.completedChunkCount() * RENDER_SPAN / total);
        return build(stage, RenderPhase.ERROR, chunkIndex, percent, "Render failed", error);
    }

    private RenderStatus build(RenderStage stage, RenderPhase phase, Integer currentChunk,
                               int percent, String message, String error) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime startedAt = stage.getStartedAt() != null ? stage.getStartedAt() : now;
        return RenderStatus.builder()
                .phase(phase)
                .totalChunks(stage.getTotalChunks())
                .completedChunks(stage.completedChunkCount())
                .currentChunk(currentChunk)
                .percent(percent)
                .message(message)
                .startedAt(startedAt)
                .lastUpdateAt(now)
                .elapsedMs(Math.max(0, Duration.between(startedAt, now).toMillis()))
                .error(error)
                .build();
    }
}

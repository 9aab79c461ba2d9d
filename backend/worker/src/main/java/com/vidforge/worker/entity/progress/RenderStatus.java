package com.vidforge.worker.entity.progress;

import com.vidforge.common.enums.RenderPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * UI 표시용 렌더 진행 상태 (파생 값)
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderStatus {
    private RenderPhase phase;
    private int totalChunks;
    private int completedChunks;
    private Integer currentChunk;
    private int percent;
    private String message;
    private LocalDateTime startedAt;
    private LocalDateTime lastUpdateAt;
    private long elapsedMs;
    private String error;
}

package com.vidforge.worker.entity.progress;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 청크 렌더 단계 기록
 *
 * chunkResults 는 완료된 청크의 누적 목록이며 재시작 시 어떤 청크를 건너뛸지 결정한다.
 * activeChunk 는 원격에서 렌더 중인 청크 (최대 1개), 결과가 나오는 즉시 비운다.
 */
@Getter
@Setter
@NoArgsConstructor
public class RenderStage extends StageProgress {
    private int totalChunks;
    /** 분할에 사용한 최대 청크 길이 - 재시작 후에도 같은 경계로 다시 분할한다 */
    private double plannedChunkDurationSeconds;
    private List<ChunkResult> chunkResults = new ArrayList<>();
    private ChunkRenderState activeChunk;
    private int attempt;

    public boolean hasChunkResult(int chunkIndex) {
        return chunkResults != null
                && chunkResults.stream().anyMatch(r -> r.getChunkIndex() == chunkIndex && r.isSuccess());
    }

    /**
     * 완료 청크 추가 (같은 인덱스가 이미 있으면 무시 → 완료 수는 감소하지 않는다)
     */
    public void addChunkResult(ChunkResult result) {
        if (chunkResults == null) {
            chunkResults = new ArrayList<>();
        }
        if (hasChunkResult(result.getChunkIndex())) {
            return;
        }
        chunkResults.add(result);
        chunkResults.sort(Comparator.comparingInt(ChunkResult::getChunkIndex));
    }

    public int completedChunkCount() {
        return chunkResults == null ? 0 : (int) chunkResults.stream().filter(ChunkResult::isSuccess).count();
    }

    public boolean allChunksComplete() {
        return totalChunks > 0 && completedChunkCount() >= totalChunks;
    }
}

package com.vidforge.worker.service.render;

import com.vidforge.worker.entity.progress.ChunkRenderState;
import com.vidforge.worker.entity.progress.ChunkResult;
import com.vidforge.worker.entity.progress.RenderStatus;

/**
 * 청크 렌더 진행 알림
 * 호출 시점에 RenderStage 는 이미 갱신되어 있으므로 구현체는 그대로 저장하면 된다.
 */
public interface RenderCallbacks {

    void onProgress(RenderStatus status);

    /**
     * 원격 디스패치 직후 (재시작 복구의 근거가 되므로 즉시 저장해야 한다)
     */
    void onChunkDispatched(ChunkRenderState state);

    /**
     * 이전 실행이 디스패치한 청크의 폴링을 이어가기 직전 (작업을 다시 rendering 으로 기록)
     */
    void onChunkResumed(ChunkRenderState state);

    void onChunkComplete(ChunkResult result);
}

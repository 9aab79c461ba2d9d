package com.vidforge.worker.service.render;

import com.vidforge.worker.dto.RenderDto;

/**
 * 원격 렌더 실행기
 */
public interface RenderExecutorClient {

    /**
     * 청크 렌더 시작
     * @throws RenderRateLimitedException 실행기 동시성 / 요청 한도 초과
     */
    RenderDto.RenderHandle dispatch(RenderDto.ChunkSpec chunkSpec);

    /**
     * 청크 상태 조회 (in_progress / complete / failed / not_found)
     */
    RenderDto.ChunkStatusResult checkStatus(String externalRenderId, String externalStorageLocation);
}

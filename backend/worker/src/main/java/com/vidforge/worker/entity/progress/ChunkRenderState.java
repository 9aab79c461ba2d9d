package com.vidforge.worker.entity.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 원격 실행기에서 렌더 중인 청크
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRenderState {
    private int chunkIndex;
    private String externalRenderId;
    private String externalStorageLocation;
    private LocalDateTime startedAt;
}

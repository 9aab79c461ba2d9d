package com.vidforge.worker.entity.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResult {
    private int chunkIndex;
    private String outputLocation;
    private boolean success;
    private long renderTimeMs;
}

package com.vidforge.worker.service.generation;

import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.SceneAssets;

/**
 * 씬 에셋 생성 서비스
 * 씬 하나 단위로 호출되며 실패는 해당 씬에만 영향을 준다.
 */
public interface AssetGenerationClient {

    /**
     * @throws com.vidforge.common.exception.JobException 생성 실패 (ASSET_GENERATION_FAILED)
     */
    SceneAssets generateAssets(Job job, Scene scene);
}

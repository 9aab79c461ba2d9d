package com.vidforge.worker.service.generation;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.SceneAssets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class HttpAssetGenerationClient implements AssetGenerationClient {

    private final RestTemplate restTemplate;
    private final WorkerProperties workerProperties;

    @Override
    public SceneAssets generateAssets(Job job, Scene scene) {
        String url = workerProperties.getServices().getAssetGenerationUrl() + "/v1/scenes/assets";

        Map<String, Object> body = new HashMap<>();
        body.put("jobId", job.getJobId());
        body.put("ownerId", job.getOwnerId());
        body.put("sceneId", scene.getSceneId());
        body.put("narration", scene.getNarration());
        body.put("visualDirection", scene.getVisualDirection());
        body.put("durationSeconds", scene.getDurationSeconds());

        try {
            SceneAssets assets = restTemplate.postForObject(url, body, SceneAssets.class);
            if (assets == null || !assets.hasAnyAsset()) {
                throw new JobException(ErrorCode.ASSET_GENERATION_FAILED,
                        "Asset generation returned no asset for scene " + scene.getSceneId());
            }
            return assets;
        } catch (RestClientException e) {
            log.warn("[AssetGeneration] Request failed - jobId={}, sceneId={}: {}",
                    job.getJobId(), scene.getSceneId(), e.getMessage());
            throw new JobException(ErrorCode.ASSET_GENERATION_FAILED,
                    "Asset generation failed for scene " + scene.getSceneId() + ": " + e.getMessage(), e);
        }
    }
}

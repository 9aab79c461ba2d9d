package com.vidforge.worker.service.analysis;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.SceneAnalysis;
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
public class HttpSceneAnalysisClient implements SceneAnalysisClient {

    private final RestTemplate restTemplate;
    private final WorkerProperties workerProperties;

    @Override
    public boolean isAvailable() {
        try {
            restTemplate.getForEntity(baseUrl() + "/health", String.class);
            return true;
        } catch (RestClientException e) {
            log.info("[SceneAnalysis] Service unavailable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public SceneAnalysis analyzeScene(String assetRef, Scene scene) {
        Map<String, Object> body = new HashMap<>();
        body.put("assetUrl", assetRef);
        body.put("sceneId", scene.getSceneId());
        body.put("narration", scene.getNarration());
        body.put("visualDirection", scene.getVisualDirection());

        try {
            SceneAnalysis analysis = restTemplate.postForObject(baseUrl() + "/v1/analyze", body, SceneAnalysis.class);
            if (analysis == null) {
                throw new JobException(ErrorCode.SCENE_ANALYSIS_FAILED, "Empty analysis for scene " + scene.getSceneId());
            }
            return analysis;
        } catch (RestClientException e) {
            throw new JobException(ErrorCode.SCENE_ANALYSIS_FAILED,
                    "Scene analysis failed for scene " + scene.getSceneId() + ": " + e.getMessage(), e);
        }
    }

    private String baseUrl() {
        return workerProperties.getServices().getSceneAnalysisUrl();
    }
}

package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.SceneAnalysis;
import com.vidforge.worker.entity.SceneAssets;
import com.vidforge.worker.entity.progress.GenerationStage;
import com.vidforge.worker.entity.progress.JobProgress;
import com.vidforge.worker.service.analysis.SceneAnalysisClient;
import com.vidforge.worker.service.generation.AssetGenerationClient;
import com.vidforge.worker.store.JobPatch;
import com.vidforge.worker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * generating 단계 진행
 *
 * - 씬마다 에셋 생성 후 즉시 저장 (크래시 시 잃는 작업은 씬 하나)
 * - 이미 에셋이 있는 씬은 건너뜀 (재claim 시 이어하기)
 * - 씬 실패는 progress.errors 에 기록하고 계속 진행
 * - 마지막에 품질 분석 (best-effort) 후 awaiting_render
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobGenerationService {

    private static final String ASSET_SERVICE = "asset-generation";
    private static final String ANALYSIS_SERVICE = "scene-analysis";

    private final JobStore jobStore;
    private final AssetGenerationClient assetGenerationClient;
    private final SceneAnalysisClient sceneAnalysisClient;
    private final Clock clock;

    public void generate(Job job) {
        String jobId = job.getJobId();
        List<Scene> scenes = job.sceneList();
        JobProgress progress = job.progressOrEmpty();
        GenerationStage stage = progress.generationOrNew();
        if (stage.getStartedAt() == null) {
            stage.setStartedAt(now());
        }
        stage.setTotalScenes(scenes.size());
        progress.setCurrentStep("generating_assets");

        log.info("[Generation] jobId={} - generating assets for {} scenes", jobId, scenes.size());

        int completed = 0;
        for (Scene scene : scenes) {
            if (scene.hasAssets()) {
                completed++;
                continue;
            }
            try {
                SceneAssets assets = assetGenerationClient.generateAssets(job, scene);
                if (assets.getGeneratedAt() == null) {
                    assets.setGeneratedAt(now());
                }
                scene.setAssets(assets);
                stage.clearSceneFailure(scene.getSceneId());
                completed++;
                log.info("[Generation] jobId={} - scene {} assets generated", jobId, scene.getSceneId());
            } catch (RuntimeException e) {
                log.warn("[Generation] jobId={} - scene {} failed: {}", jobId, scene.getSceneId(), e.getMessage());
                progress.addError("Scene " + scene.getSceneId() + ": " + e.getMessage());
                progress.addServiceFailure(ASSET_SERVICE, e.getMessage(), now());
                stage.markSceneFailed(scene.getSceneId());
            }
            stage.setCompletedScenes(completed);
            persist(job, JobPatch.builder().scenes(scenes).progress(progress), "scene " + scene.getSceneId());
        }
        stage.setCompletedScenes(completed);

        if (!scenes.isEmpty() && completed == 0) {
            throw new JobException(ErrorCode.ASSET_GENERATION_FAILED,
                    "Asset generation failed for all " + scenes.size() + " scenes");
        }

        analyzeScenes(job, scenes, progress, stage);

        stage.setCompletedAt(now());
        progress.setCurrentStep(JobStatus.AWAITING_RENDER.getCode());
        persist(job, JobPatch.builder()
                .status(JobStatus.AWAITING_RENDER)
                .scenes(scenes)
                .progress(progress), "completion");

        log.info("[Generation] jobId={} - assets ready ({}/{} scenes, {} analyzed), awaiting render request",
                jobId, completed, scenes.size(), stage.getAnalyzedScenes());
    }

    private void analyzeScenes(Job job, List<Scene> scenes, JobProgress progress, GenerationStage stage) {
        progress.setCurrentStep("analyzing_scenes");
        boolean available;
        try {
            available = sceneAnalysisClient.isAvailable();
        } catch (RuntimeException e) {
            log.warn("[Generation] jobId={} - scene analysis health check failed: {}", job.getJobId(), e.getMessage());
            available = false;
        }
        if (!available) {
            log.info("[Generation] jobId={} - scene analysis unavailable, skipping", job.getJobId());
            progress.addServiceFailure(ANALYSIS_SERVICE, "Scene analysis service unavailable", now());
            return;
        }

        int analyzed = 0;
        for (Scene scene : scenes) {
            if (!scene.hasAssets()) {
                continue;
            }
            if (scene.hasAnalysis()) {
                analyzed++;
                continue;
            }
            try {
                SceneAnalysis analysis = sceneAnalysisClient.analyzeScene(scene.getAssets().primaryAssetRef(), scene);
                if (analysis.getAnalyzedAt() == null) {
                    analysis.setAnalyzedAt(now());
                }
                scene.setAnalysis(analysis);
                analyzed++;
            } catch (RuntimeException e) {
                log.warn("[Generation] jobId={} - analysis of scene {} failed: {}",
                        job.getJobId(), scene.getSceneId(), e.getMessage());
                progress.addError("Analysis of scene " + scene.getSceneId() + ": " + e.getMessage());
                progress.addServiceFailure(ANALYSIS_SERVICE, e.getMessage(), now());
            }
        }
        stage.setAnalyzedScenes(analyzed);
        stage.setAnalysisDone(true);
    }

    private void persist(Job job, JobPatch.JobPatchBuilder patch, String phase) {
        boolean applied = jobStore.updateJob(job.getJobId(), patch
                .expectedStatus(JobStatus.GENERATING)
                .expectedLeaseId(job.getLeaseId())
                .build());
        if (!applied) {
            throw new JobOwnershipLostException(job.getJobId(), phase);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}

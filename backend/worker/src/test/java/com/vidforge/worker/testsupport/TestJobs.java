package com.vidforge.worker.testsupport;

import com.vidforge.common.enums.IssueSeverity;
import com.vidforge.common.enums.JobStatus;
import com.vidforge.common.enums.Recommendation;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.entity.AnalysisIssue;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.RenderConfig;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.SceneAnalysis;
import com.vidforge.worker.entity.SceneAssets;
import com.vidforge.worker.entity.progress.JobProgress;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 테스트용 작업 / 씬 / 설정 생성기
 */
public final class TestJobs {

    private TestJobs() {
    }

    public static Job job(String jobId, JobStatus status, List<Scene> scenes) {
        return Job.builder()
                .jobId(jobId)
                .ownerId("owner-1")
                .status(status)
                .scenes(new ArrayList<>(scenes))
                .renderConfig(renderConfig())
                .progress(new JobProgress())
                .build();
    }

    public static RenderConfig renderConfig() {
        Map<String, Object> props = new HashMap<>();
        props.put("title", "test");
        props.put("soundEffectsBaseUrl", "https://sfx.example.com");
        return RenderConfig.builder()
                .compositionId("LongVideo")
                .serveUrl("https://serve.example.com/site")
                .fps(30)
                .width(1080)
                .height(1920)
                .inputProps(props)
                .build();
    }

    public static Scene scene(String sceneId, double durationSeconds) {
        return Scene.builder()
                .sceneId(sceneId)
                .narration("narration " + sceneId)
                .durationSeconds(durationSeconds)
                .build();
    }

    public static Scene sceneWithAssets(String sceneId, double durationSeconds) {
        Scene scene = scene(sceneId, durationSeconds);
        scene.setAssets(SceneAssets.builder().videoUrl("https://cdn.example.com/" + sceneId + ".mp4").build());
        return scene;
    }

    public static Scene analysed(String sceneId, int score, Recommendation recommendation, IssueSeverity... issues) {
        Scene scene = sceneWithAssets(sceneId, 10);
        List<AnalysisIssue> list = new ArrayList<>();
        for (IssueSeverity severity : issues) {
            list.add(AnalysisIssue.builder().severity(severity).category("visual").description("issue").build());
        }
        scene.setAnalysis(SceneAnalysis.builder()
                .overallScore(score)
                .recommendation(recommendation)
                .issues(list)
                .build());
        return scene;
    }

    /**
     * 모든 대기 시간이 0 에 가까운 설정
     */
    public static WorkerProperties fastProperties() {
        WorkerProperties properties = new WorkerProperties();
        WorkerProperties.Render render = properties.getRender();
        render.setChunkPollInterval(Duration.ZERO);
        render.setInterChunkCooldown(Duration.ZERO);
        render.setRateLimitCooldown(Duration.ZERO);
        render.getThrottle().setInitialDelayMs(0);
        render.getThrottle().setMinDelayMs(0);
        render.getThrottle().setMaxDelayMs(0);
        return properties;
    }
}

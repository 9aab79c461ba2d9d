package com.vidforge.worker.service.gate;

import com.vidforge.common.enums.IssueSeverity;
import com.vidforge.common.enums.Recommendation;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.dto.QualityDto;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.Scene;
import com.vidforge.worker.entity.SceneAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * 작업 품질 리포트 (요청 시 씬 분석으로부터 다시 계산)
 */
@Component
@RequiredArgsConstructor
public class QualityReportBuilder {

    private final RenderGate renderGate;
    private final WorkerProperties workerProperties;

    public QualityDto.QualityReport build(Job job) {
        WorkerProperties.Quality cfg = workerProperties.getQuality();
        List<Scene> scenes = job.sceneList();

        List<QualityDto.SceneQuality> sceneQualities = new ArrayList<>();
        int approved = 0;
        int needsReview = 0;
        int rejected = 0;
        int pending = 0;
        for (Scene scene : scenes) {
            Recommendation status = sceneStatus(scene.getAnalysis(), cfg);
            switch (status) {
                case APPROVE -> approved++;
                case NEEDS_REVIEW -> needsReview++;
                case REJECT -> rejected++;
                default -> pending++;
            }
            SceneAnalysis analysis = scene.getAnalysis();
            sceneQualities.add(QualityDto.SceneQuality.builder()
                    .sceneId(scene.getSceneId())
                    .score(analysis != null ? analysis.getOverallScore() : null)
                    .status(status)
                    .criticalIssues(analysis != null ? analysis.countIssues(IssueSeverity.CRITICAL) : 0)
                    .majorIssues(analysis != null ? analysis.countIssues(IssueSeverity.MAJOR) : 0)
                    .minorIssues(analysis != null ? analysis.countIssues(IssueSeverity.MINOR) : 0)
                    .build());
        }

        OptionalInt aggregate = RenderGate.aggregateScore(scenes);
        long critical = RenderGate.countIssues(scenes, IssueSeverity.CRITICAL);
        QualityDto.GateVerdict verdict = renderGate.canProceedToRender(job);

        Recommendation recommendation;
        if (pending > 0 && approved + needsReview + rejected == 0) {
            recommendation = Recommendation.PENDING;
        } else if (rejected > 0 || critical > 0) {
            recommendation = Recommendation.REJECT;
        } else if (needsReview > 0
                || (aggregate.isPresent() && aggregate.getAsInt() < cfg.getMinimumProjectScore())) {
            recommendation = Recommendation.NEEDS_REVIEW;
        } else {
            recommendation = Recommendation.APPROVE;
        }

        return QualityDto.QualityReport.builder()
                .jobId(job.getJobId())
                .scenes(sceneQualities)
                .aggregateScore(aggregate.isPresent() ? aggregate.getAsInt() : null)
                .minimumProjectScore(cfg.getMinimumProjectScore())
                .recommendation(recommendation)
                .criticalIssues(critical)
                .majorIssues(RenderGate.countIssues(scenes, IssueSeverity.MAJOR))
                .minorIssues(RenderGate.countIssues(scenes, IssueSeverity.MINOR))
                .approvedScenes(approved)
                .needsReviewScenes(needsReview)
                .rejectedScenes(rejected)
                .pendingScenes(pending)
                .blockingReasons(verdict.getBlockingReasons())
                .canRender(verdict.isAllowed())
                .build();
    }

    /**
     * 씬 단위 판정
     * - reject 권고 또는 최소 점수 미만 → reject
     * - approve 권고 또는 자동 승인 점수 이상 → approve
     * - 그 외 needs_review, 분석 없음 → pending
     */
    static Recommendation sceneStatus(SceneAnalysis analysis, WorkerProperties.Quality cfg) {
        if (analysis == null) {
            return Recommendation.PENDING;
        }
        Integer score = analysis.getOverallScore();
        Recommendation recommendation = analysis.getRecommendation();
        if (recommendation == Recommendation.REJECT || (score != null && score < cfg.getMinimumSceneScore())) {
            return Recommendation.REJECT;
        }
        if (recommendation == Recommendation.APPROVE || (score != null && score >= cfg.getAutoApproveScore())) {
            return Recommendation.APPROVE;
        }
        return Recommendation.NEEDS_REVIEW;
    }
}

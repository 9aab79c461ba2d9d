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
 * 렌더 게이트
 *
 * 씬 분석 결과만으로 판정하는 순수 함수. 조건은 누적되며 (short-circuit 없음) 사유가 하나라도 있으면 막는다.
 * 관리자 강제 렌더는 이 판정을 거치지 않는 별도 경로(RenderRequestService#forceRender)다.
 */
@Component
@RequiredArgsConstructor
public class RenderGate {

    private final WorkerProperties workerProperties;

    public QualityDto.GateVerdict canProceedToRender(Job job) {
        return evaluate(job.sceneList(), job.isReviewOverride());
    }

    public QualityDto.GateVerdict evaluate(List<Scene> scenes, boolean reviewOverride) {
        List<String> reasons = new ArrayList<>();

        long rejected = countRecommendation(scenes, Recommendation.REJECT);
        if (rejected > 0) {
            reasons.add(rejected + " rejected scene(s) need regeneration");
        }

        long needsReview = countRecommendation(scenes, Recommendation.NEEDS_REVIEW);
        if (needsReview > 0 && !reviewOverride) {
            reasons.add(needsReview + " scene(s) marked needs_review without reviewer override");
        }

        long critical = countIssues(scenes, IssueSeverity.CRITICAL);
        if (critical > 0) {
            reasons.add(critical + " critical issue(s) (max 0)");
        }

        OptionalInt aggregate = aggregateScore(scenes);
        int minimum = workerProperties.getQuality().getMinimumProjectScore();
        if (aggregate.isPresent() && aggregate.getAsInt() < minimum) {
            reasons.add("Overall score " + aggregate.getAsInt() + " below minimum " + minimum);
        }

        return new QualityDto.GateVerdict(reasons);
    }

    /**
     * 분석된 씬 점수의 반올림 평균 (분석된 씬이 없으면 비어 있음)
     */
    public static OptionalInt aggregateScore(List<Scene> scenes) {
        int sum = 0;
        int count = 0;
        for (Scene scene : scenes) {
            SceneAnalysis analysis = scene.getAnalysis();
            if (analysis != null && analysis.getOverallScore() != null) {
                sum += analysis.getOverallScore();
                count++;
            }
        }
        return count == 0 ? OptionalInt.empty() : OptionalInt.of((int) Math.round((double) sum / count));
    }

    public static long countIssues(List<Scene> scenes, IssueSeverity severity) {
        return scenes.stream()
                .filter(Scene::hasAnalysis)
                .mapToLong(s -> s.getAnalysis().countIssues(severity))
                .sum();
    }

    private static long countRecommendation(List<Scene> scenes, Recommendation recommendation) {
        return scenes.stream()
                .filter(Scene::hasAnalysis)
                .filter(s -> s.getAnalysis().getRecommendation() == recommendation)
                .count();
    }
}

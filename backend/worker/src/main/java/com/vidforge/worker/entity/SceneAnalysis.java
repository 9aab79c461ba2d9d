package com.vidforge.worker.entity;

import com.vidforge.common.enums.IssueSeverity;
import com.vidforge.common.enums.Recommendation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 씬 품질 분석 결과
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SceneAnalysis {
    private Integer overallScore;              // 0 ~ 100
    private Recommendation recommendation;
    private List<AnalysisIssue> issues;
    private LocalDateTime analyzedAt;

    public long countIssues(IssueSeverity severity) {
        if (issues == null) {
            return 0;
        }
        return issues.stream().filter(i -> i.getSeverity() == severity).count();
    }
}

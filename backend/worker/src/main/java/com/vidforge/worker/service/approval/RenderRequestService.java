package com.vidforge.worker.service.approval;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.dto.QualityDto;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.progress.JobProgress;
import com.vidforge.worker.entity.progress.OverrideAudit;
import com.vidforge.worker.service.gate.QualityReportBuilder;
import com.vidforge.worker.service.gate.RenderGate;
import com.vidforge.worker.store.JobPatch;
import com.vidforge.worker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * 렌더 요청 / 검토 승인 / 관리자 강제 렌더
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RenderRequestService {

    private static final Set<JobStatus> FORCEABLE = EnumSet.of(JobStatus.AWAITING_RENDER, JobStatus.ERROR);

    private final JobStore jobStore;
    private final RenderGate renderGate;
    private final QualityReportBuilder qualityReportBuilder;
    private final Clock clock;

    /**
     * 게이트 통과 시 awaiting_render → render_queued
     * 차단되면 상태는 그대로 두고 사유만 돌려준다.
     */
    public QualityDto.GateVerdict requestRender(String jobId) {
        Job job = loadJob(jobId);
        requireStatus(job, EnumSet.of(JobStatus.AWAITING_RENDER));

        QualityDto.GateVerdict verdict = renderGate.canProceedToRender(job);
        if (!verdict.isAllowed()) {
            log.info("[RenderRequest] jobId={} - blocked: {}", jobId, verdict.getBlockingReasons());
            return verdict;
        }

        JobProgress progress = job.progressOrEmpty();
        progress.setCurrentStep(JobStatus.RENDER_QUEUED.getCode());
        boolean applied = jobStore.updateJob(jobId, JobPatch.builder()
                .status(JobStatus.RENDER_QUEUED)
                .progress(progress)
                .expectedStatus(JobStatus.AWAITING_RENDER)
                .build());
        if (!applied) {
            throw new JobException(ErrorCode.INVALID_JOB_STATE,
                    "Job " + jobId + " left awaiting_render before the render request was applied");
        }
        log.info("[RenderRequest] jobId={} - queued for render", jobId);
        return verdict;
    }

    /**
     * needs_review 씬을 사람이 확인했음을 기록
     */
    public void setReviewOverride(String jobId, String reviewerId) {
        Job job = loadJob(jobId);
        jobStore.updateJob(jobId, JobPatch.builder().reviewOverride(true).build());
        log.info("[RenderRequest] jobId={} - review override set by {} (status: {})",
                jobId, reviewerId, job.getStatus().getCode());
    }

    /**
     * 관리자 강제 렌더 - 게이트 결과와 무관하게 render_queued
     * 게이트는 우회한 사유를 감사 기록에 남기기 위해서만 평가한다.
     */
    public void forceRender(String jobId, String adminId, String reason) {
        if (adminId == null || adminId.isBlank() || reason == null || reason.isBlank()) {
            throw new JobException(ErrorCode.INVALID_REQUEST, "Force render requires an admin id and a reason");
        }
        Job job = loadJob(jobId);
        requireStatus(job, FORCEABLE);

        QualityDto.GateVerdict bypassed = renderGate.canProceedToRender(job);

        JobProgress progress = job.progressOrEmpty();
        progress.addOverrideAudit(OverrideAudit.builder()
                .adminId(adminId)
                .reason(reason)
                .bypassedReasons(bypassed.getBlockingReasons())
                .overriddenAt(LocalDateTime.now(clock))
                .build());
        progress.setCurrentStep(JobStatus.RENDER_QUEUED.getCode());

        boolean applied = jobStore.updateJob(jobId, JobPatch.builder()
                .status(JobStatus.RENDER_QUEUED)
                .progress(progress)
                .expectedStatus(job.getStatus())
                .build());
        if (!applied) {
            throw new JobException(ErrorCode.INVALID_JOB_STATE,
                    "Job " + jobId + " changed state before the force render was applied");
        }
        log.warn("[RenderRequest] jobId={} - FORCE RENDER by {} (reason: {}), bypassed: {}",
                jobId, adminId, reason, bypassed.getBlockingReasons());
    }

    public QualityDto.QualityReport qualityReport(String jobId) {
        return qualityReportBuilder.build(loadJob(jobId));
    }

    private Job loadJob(String jobId) {
        return jobStore.getJob(jobId)
                .orElseThrow(() -> new JobException(ErrorCode.JOB_NOT_FOUND, "Job not found: " + jobId));
    }

    private void requireStatus(Job job, Set<JobStatus> allowed) {
        if (!allowed.contains(job.getStatus())) {
            throw new JobException(ErrorCode.INVALID_JOB_STATE,
                    "Job " + job.getJobId() + " is " + job.getStatus().getCode() + ", expected one of " + allowed);
        }
    }
}

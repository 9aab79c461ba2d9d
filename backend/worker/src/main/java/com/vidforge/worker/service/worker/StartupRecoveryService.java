package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.config.WorkerIdentity;
import com.vidforge.worker.dto.RenderDto;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.progress.ChunkRenderState;
import com.vidforge.worker.entity.progress.JobProgress;
import com.vidforge.worker.entity.progress.RenderStage;
import com.vidforge.worker.service.render.ChunkedRenderOrchestrator;
import com.vidforge.worker.store.JobPatch;
import com.vidforge.worker.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 시작 시 1회, 폴러 시작 전에 실행되는 렌더 복구
 *
 * rendering / lambda_pending 작업마다 먼저 조건부로 인수한다 (조회 이후 다른 워커가 썼다면 건너뜀).
 * 인수하면 새 lease 가 발급되어, 이전 소유 워커가 아직 살아 있어도 그 워커의 다음 진행 중 쓰기는 반영되지 않는다.
 * 인수한 작업에 대해:
 * - activeChunk 없음 + 모든 청크 완료 → 병합 (백그라운드)
 * - activeChunk 없음 + 남은 청크 있음 → render_queued
 * - activeChunk 있음 → 실행기에 직접 조회
 *   in_progress → 백그라운드에서 폴링 이어감
 *   complete → 결과 기록 후 위 두 규칙 적용
 *   failed / not_found → activeChunk 비우고 render_queued
 */
@Slf4j
@Service
public class StartupRecoveryService {

    private final JobStore jobStore;
    private final ChunkedRenderOrchestrator orchestrator;
    private final JobRenderService jobRenderService;
    private final TaskExecutor recoveryExecutor;
    private final WorkerIdentity workerIdentity;
    private final Clock clock;

    public StartupRecoveryService(JobStore jobStore, ChunkedRenderOrchestrator orchestrator,
                                  JobRenderService jobRenderService,
                                  @Qualifier("recoveryExecutor") TaskExecutor recoveryExecutor,
                                  WorkerIdentity workerIdentity, Clock clock) {
        this.jobStore = jobStore;
        this.orchestrator = orchestrator;
        this.jobRenderService = jobRenderService;
        this.recoveryExecutor = recoveryExecutor;
        this.workerIdentity = workerIdentity;
        this.clock = clock;
    }

    /**
     * @return 복구 대상으로 본 작업 수
     */
    public int recover() {
        List<Job> jobs = jobStore.scanByStatus(JobStatus.RENDER_ACTIVE);
        log.info("[Recovery] Found {} job(s) with an in-flight render", jobs.size());

        for (Job scanned : jobs) {
            try {
                Optional<Job> adopted = jobStore.adoptJob(scanned.getJobId(), JobStatus.RENDER_ACTIVE,
                        scanned.getUpdatedAt(), workerIdentity.getWorkerId());
                if (adopted.isEmpty()) {
                    log.info("[Recovery] jobId={} - updated by another worker since scan, leaving it (owner={})",
                            scanned.getJobId(), scanned.getWorkerId());
                    continue;
                }
                recoverJob(adopted.get());
            } catch (RuntimeException e) {
                // 나머지 작업 복구는 계속; 이 작업은 정체 감지기가 되돌린다
                log.error("[Recovery] jobId={} - recovery failed: {}", scanned.getJobId(), e.getMessage(), e);
            }
        }
        return jobs.size();
    }

    private void recoverJob(Job job) {
        String jobId = job.getJobId();
        JobProgress progress = job.progressOrEmpty();
        RenderStage stage = progress.renderOrNew();
        ChunkRenderState active = stage.getActiveChunk();

        if (active == null) {
            continueWithoutActiveChunk(job, progress, stage);
            return;
        }

        RenderDto.ChunkStatusResult status;
        try {
            status = orchestrator.queryActiveChunk(active);
        } catch (RuntimeException e) {
            log.warn("[Recovery] jobId={} - status query for chunk {} failed, leaving job for stall detection: {}",
                    jobId, active.getChunkIndex(), e.getMessage());
            return;
        }

        switch (status.getStatus()) {
            case IN_PROGRESS -> {
                log.info("[Recovery] jobId={} - chunk {} still rendering ({}%), resuming in background",
                        jobId, active.getChunkIndex(), status.getPercent());
                recoveryExecutor.execute(() -> jobRenderService.resumeInBackground(job));
            }
            case COMPLETE -> {
                if (status.getOutputLocation() == null || status.getOutputLocation().isBlank()) {
                    requeue(job, progress, stage, "Chunk " + active.getChunkIndex() + " completed without output");
                    return;
                }
                orchestrator.recordCompletion(stage, active, status.getOutputLocation());
                log.info("[Recovery] jobId={} - chunk {} completed while worker was down",
                        jobId, active.getChunkIndex());
                continueWithoutActiveChunk(job, progress, stage);
            }
            default -> requeue(job, progress, stage,
                    "Chunk " + active.getChunkIndex() + " " + status.getStatus().getCode()
                            + " after restart: " + status.getError());
        }
    }

    private void continueWithoutActiveChunk(Job job, JobProgress progress, RenderStage stage) {
        if (stage.allChunksComplete()) {
            log.info("[Recovery] jobId={} - all {} chunks complete, finalizing", job.getJobId(), stage.getTotalChunks());
            boolean applied = jobStore.updateJob(job.getJobId(), JobPatch.builder()
                    .progress(progress)
                    .clearExternalRender(true)
                    .expectedStatuses(JobStatus.RENDER_ACTIVE)
                    .expectedLeaseId(job.getLeaseId())
                    .build());
            if (!applied) {
                log.warn("[Recovery] jobId={} - taken over before finalize, leaving it", job.getJobId());
                return;
            }
            recoveryExecutor.execute(() -> jobRenderService.resumeInBackground(job));
            return;
        }
        requeue(job, progress, stage, null);
    }

    private void requeue(Job job, JobProgress progress, RenderStage stage, String error) {
        stage.setActiveChunk(null);
        if (error != null) {
            progress.addError(error);
            progress.addServiceFailure("render-executor", error, LocalDateTime.now(clock));
        }
        progress.setCurrentStep(JobStatus.RENDER_QUEUED.getCode());
        boolean applied = jobStore.updateJob(job.getJobId(), JobPatch.builder()
                .status(JobStatus.RENDER_QUEUED)
                .progress(progress)
                .clearExternalRender(true)
                .expectedStatuses(JobStatus.RENDER_ACTIVE)
                .expectedLeaseId(job.getLeaseId())
                .build());
        log.info("[Recovery] jobId={} - {} chunks complete, returned to render_queued (applied={})",
                job.getJobId(), stage.completedChunkCount(), applied);
    }
}

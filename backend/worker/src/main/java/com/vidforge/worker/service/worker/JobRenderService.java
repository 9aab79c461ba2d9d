package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.dto.RenderDto;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.RenderConfig;
import com.vidforge.worker.entity.progress.ChunkRenderState;
import com.vidforge.worker.entity.progress.ChunkResult;
import com.vidforge.worker.entity.progress.JobProgress;
import com.vidforge.worker.entity.progress.RenderStage;
import com.vidforge.worker.entity.progress.RenderStatus;
import com.vidforge.worker.service.render.ChunkedRenderOrchestrator;
import com.vidforge.worker.service.render.RenderCallbacks;
import com.vidforge.worker.service.render.RenderFailedException;
import com.vidforge.worker.service.render.RenderStatusProjector;
import com.vidforge.worker.store.JobPatch;
import com.vidforge.worker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * lambda_pending / rendering 단계 진행
 *
 * 청크 디스패치 → rendering, 진행률 / 청크 완료는 즉시 저장.
 * retryable 실패는 render_queued 로 되돌리고 (완료 청크 유지) 치명적 실패는 error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRenderService {

    private static final String RENDER_SERVICE = "render-executor";

    private final JobStore jobStore;
    private final ChunkedRenderOrchestrator orchestrator;
    private final RenderStatusProjector statusProjector;
    private final JobFailureHandler failureHandler;
    private final WorkerProperties workerProperties;
    private final Clock clock;

    /**
     * claim 된 작업 또는 재시작 복구 대상 작업을 끝까지 렌더
     */
    public void render(Job job) throws InterruptedException {
        String jobId = job.getJobId();
        RenderDto.RenderSpec spec = toRenderSpec(job);

        JobProgress progress = job.progressOrEmpty();
        RenderStage stage = progress.renderOrNew();
        stage.setAttempt(stage.getAttempt() + 1);
        progress.setCurrentStep("rendering");

        log.info("[Render] jobId={} - render attempt {} ({} chunks already complete)",
                jobId, stage.getAttempt(), stage.completedChunkCount());

        try {
            String outputLocation = orchestrator.renderLongVideo(spec, stage, new PersistingCallbacks(jobId, job.getLeaseId(), progress));

            progress.setCurrentStep(JobStatus.COMPLETE.getCode());
            jobStore.updateJob(jobId, JobPatch.builder()
                    .status(JobStatus.COMPLETE)
                    .outputLocation(outputLocation)
                    .progress(progress)
                    .clearExternalRender(true)
                    .build());
            log.info("[Render] jobId={} - complete: {}", jobId, outputLocation);
        } catch (RenderFailedException e) {
            if (!e.isRetryable()) {
                failureHandler.markFailed(job, e);
                return;
            }
            requeue(job, progress, stage, e);
        }
    }

    /**
     * 백그라운드 복구 실행용 - 인터럽트는 종료 신호이므로 상태를 건드리지 않는다
     */
    public void resumeInBackground(Job job) {
        try {
            render(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Render] jobId={} - background resume interrupted by shutdown", job.getJobId());
        } catch (JobOwnershipLostException e) {
            log.warn("[Render] jobId={} - {}", job.getJobId(), e.getMessage());
        } catch (RuntimeException e) {
            failureHandler.markFailed(job, e);
        }
    }

    RenderDto.RenderSpec toRenderSpec(Job job) {
        RenderConfig config = job.getRenderConfig();
        if (config == null || !config.hasComposition()) {
            throw new JobException(ErrorCode.RENDER_CONFIG_MISSING,
                    "Job " + job.getJobId() + " has no render composition configured");
        }
        return RenderDto.RenderSpec.builder()
                .jobId(job.getJobId())
                .compositionId(config.getCompositionId())
                .serveUrl(config.getServeUrl())
                .fps(config.getFps() != null && config.getFps() > 0
                        ? config.getFps() : workerProperties.getRender().getDefaultFps())
                .width(config.getWidth())
                .height(config.getHeight())
                .inputProps(config.getInputProps())
                .scenes(job.sceneList())
                .build();
    }

    private void requeue(Job job, JobProgress progress, RenderStage stage, RenderFailedException e) {
        String jobId = job.getJobId();
        log.warn("[Render] jobId={} - chunk {} failed (retryable), returning to render_queued: {}",
                jobId, e.getChunkIndex(), e.getMessage());

        stage.setActiveChunk(null);
        progress.addError("Render attempt " + stage.getAttempt() + " failed at chunk " + e.getChunkIndex()
                + ": " + e.getMessage());
        progress.addServiceFailure(RENDER_SERVICE, e.toJobMessage(), LocalDateTime.now(clock));
        progress.setRenderStatus(statusProjector.error(stage, e.getChunkIndex(), e.getMessage()));
        progress.setCurrentStep(JobStatus.RENDER_QUEUED.getCode());

        boolean applied = jobStore.updateJob(jobId, JobPatch.builder()
                .status(JobStatus.RENDER_QUEUED)
                .progress(progress)
                .clearExternalRender(true)
                .expectedStatuses(JobStatus.RENDER_ACTIVE)
                .expectedLeaseId(job.getLeaseId())
                .build());
        if (!applied) {
            log.warn("[Render] jobId={} - requeue skipped, job left render state or was taken over", jobId);
        }
    }

    /**
     * 오케스트레이터 콜백 → 작업 레코드 저장
     * 진행 중 쓰기는 렌더 상태이고 이 워커의 lease 가 유지될 때만 반영되며, 반영되지 않으면 이 워커는 손을 뗀다.
     */
    private class PersistingCallbacks implements RenderCallbacks {

        private final String jobId;
        private final String leaseId;
        private final JobProgress progress;

        PersistingCallbacks(String jobId, String leaseId, JobProgress progress) {
            this.jobId = jobId;
            this.leaseId = leaseId;
            this.progress = progress;
        }

        @Override
        public void onProgress(RenderStatus status) {
            progress.setRenderStatus(status);
            persist(JobPatch.builder().progress(progress), "progress");
        }

        @Override
        public void onChunkDispatched(ChunkRenderState state) {
            persist(JobPatch.builder()
                    .status(JobStatus.RENDERING)
                    .externalRenderId(state.getExternalRenderId())
                    .externalStorageLocation(state.getExternalStorageLocation())
                    .progress(progress), "chunk " + state.getChunkIndex() + " dispatch");
        }

        @Override
        public void onChunkResumed(ChunkRenderState state) {
            persist(JobPatch.builder()
                    .status(JobStatus.RENDERING)
                    .externalRenderId(state.getExternalRenderId())
                    .externalStorageLocation(state.getExternalStorageLocation())
                    .progress(progress), "chunk " + state.getChunkIndex() + " resume");
        }

        @Override
        public void onChunkComplete(ChunkResult result) {
            persist(JobPatch.builder()
                    .progress(progress)
                    .clearExternalRender(true), "chunk " + result.getChunkIndex() + " completion");
        }

        private void persist(JobPatch.JobPatchBuilder patch, String phase) {
            boolean applied = jobStore.updateJob(jobId, patch
                    .expectedStatuses(JobStatus.RENDER_ACTIVE)
                    .expectedLeaseId(leaseId)
                    .build());
            if (!applied) {
                throw new JobOwnershipLostException(jobId, phase);
            }
        }
    }
}

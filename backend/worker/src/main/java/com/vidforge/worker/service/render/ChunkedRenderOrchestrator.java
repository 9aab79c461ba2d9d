package com.vidforge.worker.service.render;

import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.dto.RenderDto;
import com.vidforge.worker.entity.progress.ChunkRenderState;
import com.vidforge.worker.entity.progress.ChunkResult;
import com.vidforge.worker.entity.progress.RenderStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 긴 영상 청크 렌더
 *
 * 1. 타임라인을 최대 길이 이하의 청크로 분할
 * 2. RenderStage 에 결과가 없는 청크만 순서대로 디스패치 → activeChunk 저장 → 완료까지 폴링
 * 3. 모든 청크 완료 시 병합 후 최종 위치 반환
 *
 * activeChunk 가 남아 있는 stage 를 받으면 새로 디스패치하기 전에 그 청크부터 조회한다 (재시작 이어하기).
 * 청크 실패 / not_found / 시간 초과는 activeChunk 를 비운 뒤 retryable RenderFailedException 으로 올린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChunkedRenderOrchestrator {

    private final RenderExecutorClient executorClient;
    private final ChunkPlanner chunkPlanner;
    private final RenderDispatchThrottle dispatchThrottle;
    private final RenderStatusProjector statusProjector;
    private final ChunkConcatenationService concatenationService;
    private final WorkerProperties workerProperties;
    private final Clock clock;

    public String renderLongVideo(RenderDto.RenderSpec spec, RenderStage stage, RenderCallbacks callbacks)
            throws InterruptedException {
        String jobId = spec.getJobId();
        List<RenderDto.ChunkPlan> chunks = plan(spec, stage);
        int totalChunks = chunks.size();

        if (stage.getStartedAt() == null) {
            stage.setStartedAt(now());
        }
        stage.setTotalChunks(totalChunks);
        callbacks.onProgress(statusProjector.preparing(stage,
                "Prepared " + totalChunks + " chunks, " + stage.completedChunkCount() + " already complete"));

        log.info("[ChunkedRender] jobId={} - starting render: {} chunks, {} completed, active={}",
                jobId, totalChunks, stage.completedChunkCount(),
                stage.getActiveChunk() != null ? stage.getActiveChunk().getChunkIndex() : "none");

        ChunkRenderState active = stage.getActiveChunk();
        if (active != null) {
            if (stage.hasChunkResult(active.getChunkIndex()) || active.getChunkIndex() >= totalChunks) {
                log.warn("[ChunkedRender] jobId={} - discarding stale active chunk {}", jobId, active.getChunkIndex());
                stage.setActiveChunk(null);
            } else {
                log.info("[ChunkedRender] jobId={} - resuming in-flight chunk {} (renderId={})",
                        jobId, active.getChunkIndex(), active.getExternalRenderId());
                callbacks.onChunkResumed(active);
                awaitChunk(jobId, stage, active, callbacks);
            }
        }

        boolean dispatched = false;
        for (RenderDto.ChunkPlan chunk : chunks) {
            if (stage.hasChunkResult(chunk.getChunkIndex())) {
                log.debug("[ChunkedRender] jobId={} - chunk {} already complete, skipping", jobId, chunk.getChunkIndex());
                continue;
            }
            if (dispatched) {
                sleep(workerProperties.getRender().getInterChunkCooldown());
            }

            ChunkRenderState state = dispatch(spec, chunk, totalChunks);
            stage.setActiveChunk(state);
            callbacks.onChunkDispatched(state);
            dispatched = true;

            awaitChunk(jobId, stage, state, callbacks);
        }

        return finalizeRender(jobId, stage, callbacks);
    }

    /**
     * 모든 청크가 완료된 stage 를 최종 영상으로 만든다 (청크가 하나면 그 출력이 곧 최종 영상)
     */
    public String finalizeRender(String jobId, RenderStage stage, RenderCallbacks callbacks) throws InterruptedException {
        if (!stage.allChunksComplete()) {
            throw new JobException(ErrorCode.INVALID_JOB_STATE, "Job " + jobId + " has " + stage.completedChunkCount()
                    + "/" + stage.getTotalChunks() + " chunks complete, cannot finalize");
        }

        String location;
        if (stage.getTotalChunks() == 1) {
            location = stage.getChunkResults().get(0).getOutputLocation();
        } else {
            try {
                location = concatenationService.concatenate(jobId, stage, callbacks);
            } catch (JobException e) {
                if (e.getErrorCode() != ErrorCode.RENDER_ASSEMBLY_FAILED) {
                    throw e;
                }
                throw RenderFailedException.fatal(ErrorCode.RENDER_ASSEMBLY_FAILED, -1, e.getMessage(), e);
            }
        }

        stage.setCompletedAt(now());
        callbacks.onProgress(statusProjector.complete(stage));
        log.info("[ChunkedRender] jobId={} - render complete: {}", jobId, location);
        return location;
    }

    /**
     * activeChunk 하나를 한 번 조회 (재시작 복구용)
     */
    public RenderDto.ChunkStatusResult queryActiveChunk(ChunkRenderState state) {
        return executorClient.checkStatus(state.getExternalRenderId(), state.getExternalStorageLocation());
    }

    /**
     * 완료 응답을 stage 에 반영하고 activeChunk 를 비운다
     */
    public ChunkResult recordCompletion(RenderStage stage, ChunkRenderState state, String outputLocation) {
        ChunkResult result = ChunkResult.builder()
                .chunkIndex(state.getChunkIndex())
                .outputLocation(outputLocation)
                .success(true)
                .renderTimeMs(state.getStartedAt() != null
                        ? Math.max(0, Duration.between(state.getStartedAt(), now()).toMillis()) : 0)
                .build();
        stage.addChunkResult(result);
        stage.setActiveChunk(null);
        return result;
    }

    private List<RenderDto.ChunkPlan> plan(RenderDto.RenderSpec spec, RenderStage stage) {
        double maxDuration = stage.getPlannedChunkDurationSeconds() > 0
                ? stage.getPlannedChunkDurationSeconds()
                : workerProperties.getRender().getMaxChunkDurationSeconds();
        stage.setPlannedChunkDurationSeconds(maxDuration);

        List<RenderDto.ChunkPlan> chunks = chunkPlanner.plan(spec, maxDuration);
        if (stage.getTotalChunks() > 0 && stage.getTotalChunks() != chunks.size()) {
            throw RenderFailedException.fatal(ErrorCode.INVALID_JOB_STATE, -1,
                    "Chunk plan changed for job " + spec.getJobId() + ": recorded " + stage.getTotalChunks()
                            + " chunks, planned " + chunks.size(), null);
        }
        return chunks;
    }

    private ChunkRenderState dispatch(RenderDto.RenderSpec spec, RenderDto.ChunkPlan chunk, int totalChunks)
            throws InterruptedException {
        RenderDto.ChunkSpec chunkSpec = chunkPlanner.buildChunkSpec(spec, chunk, totalChunks);
        WorkerProperties.Render cfg = workerProperties.getRender();
        int maxAttempts = cfg.getMaxDispatchAttempts();

        for (int attempt = 1; ; attempt++) {
            dispatchThrottle.waitIfNeeded();
            try {
                RenderDto.RenderHandle handle = executorClient.dispatch(chunkSpec);
                dispatchThrottle.recordSuccess();
                log.info("[ChunkedRender] jobId={} - chunk {}/{} dispatched: renderId={}, frames {}-{}",
                        spec.getJobId(), chunk.getChunkIndex() + 1, totalChunks, handle.getExternalRenderId(),
                        chunk.getStartFrame(), chunk.getEndFrame());
                return ChunkRenderState.builder()
                        .chunkIndex(chunk.getChunkIndex())
                        .externalRenderId(handle.getExternalRenderId())
                        .externalStorageLocation(handle.getExternalStorageLocation())
                        .startedAt(now())
                        .build();
            } catch (RenderRateLimitedException e) {
                dispatchThrottle.recordRateLimited();
                if (attempt >= maxAttempts) {
                    throw RenderFailedException.retryable(ErrorCode.RENDER_RATE_LIMITED, chunk.getChunkIndex(),
                            "Chunk " + chunk.getChunkIndex() + " rate limited after " + attempt + " attempts", e);
                }
                Duration cooldown = cfg.getRateLimitCooldown().multipliedBy(attempt);
                log.warn("[ChunkedRender] jobId={} - chunk {} rate limited (attempt {}/{}), cooling down {}s",
                        spec.getJobId(), chunk.getChunkIndex(), attempt, maxAttempts, cooldown.getSeconds());
                sleep(cooldown);
            } catch (RuntimeException e) {
                throw RenderFailedException.retryable(ErrorCode.RENDER_DISPATCH_FAILED, chunk.getChunkIndex(),
                        "Chunk " + chunk.getChunkIndex() + " dispatch failed: " + e.getMessage(), e);
            }
        }
    }

    private void awaitChunk(String jobId, RenderStage stage, ChunkRenderState state, RenderCallbacks callbacks)
            throws InterruptedException {
        WorkerProperties.Render cfg = workerProperties.getRender();
        int chunkIndex = state.getChunkIndex();
        int consecutiveErrors = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while polling chunk " + chunkIndex);
            }

            RenderDto.ChunkStatusResult status;
            try {
                status = queryActiveChunk(state);
                consecutiveErrors = 0;
            } catch (RuntimeException e) {
                consecutiveErrors++;
                log.warn("[ChunkedRender] jobId={} - status check for chunk {} failed ({}/{}): {}",
                        jobId, chunkIndex, consecutiveErrors, cfg.getMaxConsecutivePollErrors(), e.getMessage());
                if (consecutiveErrors >= cfg.getMaxConsecutivePollErrors()) {
                    stage.setActiveChunk(null);
                    throw RenderFailedException.retryable(ErrorCode.RENDER_CHUNK_FAILED, chunkIndex,
                            "Chunk " + chunkIndex + " status unavailable after " + consecutiveErrors + " attempts", e);
                }
                sleep(cfg.getChunkPollInterval());
                continue;
            }

            switch (status.getStatus()) {
                case COMPLETE:
                    if (status.getOutputLocation() == null || status.getOutputLocation().isBlank()) {
                        stage.setActiveChunk(null);
                        throw RenderFailedException.retryable(ErrorCode.RENDER_CHUNK_FAILED, chunkIndex,
                                "Chunk " + chunkIndex + " completed without output", null);
                    }
                    ChunkResult result = recordCompletion(stage, state, status.getOutputLocation());
                    log.info("[ChunkedRender] jobId={} - chunk {}/{} complete in {}ms: {}", jobId, chunkIndex + 1,
                            stage.getTotalChunks(), result.getRenderTimeMs(), result.getOutputLocation());
                    callbacks.onChunkComplete(result);
                    return;
                case FAILED:
                case NOT_FOUND:
                    stage.setActiveChunk(null);
                    throw RenderFailedException.retryable(ErrorCode.RENDER_CHUNK_FAILED, chunkIndex,
                            "Chunk " + chunkIndex + " " + status.getStatus().getCode() + ": " + status.getError(), null);
                case IN_PROGRESS:
                default:
                    callbacks.onProgress(statusProjector.rendering(stage, chunkIndex, status.getPercent()));
                    if (isTimedOut(state, cfg.getChunkTimeout())) {
                        stage.setActiveChunk(null);
                        throw RenderFailedException.retryable(ErrorCode.RENDER_CHUNK_TIMEOUT, chunkIndex,
                                "Chunk " + chunkIndex + " exceeded " + cfg.getChunkTimeout().toSeconds() + "s", null);
                    }
                    sleep(cfg.getChunkPollInterval());
            }
        }
    }

    private boolean isTimedOut(ChunkRenderState state, Duration timeout) {
        if (state.getStartedAt() == null) {
            return false;
        }
        return Duration.between(state.getStartedAt(), now()).compareTo(timeout) > 0;
    }

    private void sleep(Duration duration) throws InterruptedException {
        if (duration != null && !duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}

package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.config.WorkerIdentity;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 작업 폴러 / 상태 머신 구동
 *
 * 틱마다 render_queued 하나(우선) 또는 queued 하나를 조건부 claim 하여 끝까지 진행한다.
 * claim 자체가 상호 배제이므로 "처리 중" 플래그는 두지 않는다.
 * 틱은 fixed-delay 로 실행되어 겹치지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobPoller {

    private final JobStore jobStore;
    private final JobGenerationService jobGenerationService;
    private final JobRenderService jobRenderService;
    private final JobFailureHandler failureHandler;
    private final WorkerIdentity workerIdentity;

    /**
     * @return 이번 틱에 작업을 처리했는지
     */
    public boolean tick() throws InterruptedException {
        String workerId = workerIdentity.getWorkerId();

        Optional<Job> renderJob = jobStore.claimJob(JobStatus.RENDER_QUEUED, JobStatus.LAMBDA_PENDING, workerId);
        if (renderJob.isPresent()) {
            Job job = renderJob.get();
            log.info("[JobPoller] Claimed render job {} ({})", job.getJobId(), workerId);
            drive(job, () -> jobRenderService.render(job));
            return true;
        }

        Optional<Job> generationJob = jobStore.claimJob(JobStatus.QUEUED, JobStatus.GENERATING, workerId);
        if (generationJob.isPresent()) {
            Job job = generationJob.get();
            log.info("[JobPoller] Claimed generation job {} ({})", job.getJobId(), workerId);
            drive(job, () -> jobGenerationService.generate(job));
            return true;
        }

        return false;
    }

    /**
     * 스케줄러 진입점
     */
    public void runScheduled() {
        try {
            tick();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[JobPoller] Tick interrupted by shutdown");
        } catch (RuntimeException e) {
            log.error("[JobPoller] Tick failed: {}", e.getMessage(), e);
        }
    }

    private void drive(Job job, Step step) throws InterruptedException {
        try {
            step.run();
        } catch (JobOwnershipLostException e) {
            log.warn("[JobPoller] jobId={} - {}", job.getJobId(), e.getMessage());
        } catch (RuntimeException e) {
            failureHandler.markFailed(job, e);
        }
    }

    @FunctionalInterface
    private interface Step {
        void run() throws InterruptedException;
    }
}

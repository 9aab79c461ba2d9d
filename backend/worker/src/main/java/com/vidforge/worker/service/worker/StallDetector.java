package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.worker.config.WorkerProperties;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 정체 작업 되돌리기 (폴러와 독립된 타이머)
 * - generating 이 generation-threshold 이상 갱신 없음 → queued
 * - lambda_pending / rendering 이 render-threshold 이상 갱신 없음 → render_queued
 * 조건부 상태 쓰기만 하며 원격 실행기에는 아무것도 하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StallDetector {

    private final JobStore jobStore;
    private final WorkerProperties workerProperties;
    private final Clock clock;

    /**
     * @return 되돌린 작업 수
     */
    public int detect() {
        LocalDateTime now = LocalDateTime.now(clock);
        WorkerProperties.Stall cfg = workerProperties.getStall();

        int reset = resetStale(List.of(JobStatus.GENERATING), JobStatus.QUEUED,
                now.minus(cfg.getGenerationThreshold()));
        reset += resetStale(List.copyOf(JobStatus.RENDER_ACTIVE), JobStatus.RENDER_QUEUED,
                now.minus(cfg.getRenderThreshold()));

        if (reset > 0) {
            log.info("[StallDetector] Requeued {} stalled job(s)", reset);
        }
        return reset;
    }

    /**
     * 스케줄러 진입점 - 예외가 새어 나가면 이후 실행이 멈추므로 여기서 끊는다
     */
    public void runScheduled() {
        try {
            detect();
        } catch (RuntimeException e) {
            log.error("[StallDetector] Stall check failed: {}", e.getMessage(), e);
        }
    }

    private int resetStale(List<JobStatus> statuses, JobStatus target, LocalDateTime cutoff) {
        int count = 0;
        for (Job job : jobStore.scanStale(statuses, cutoff)) {
            if (jobStore.resetIfStale(job.getJobId(), job.getStatus(), target, cutoff)) {
                count++;
                log.warn("[StallDetector] jobId={} - {} since {}, reset to {}",
                        job.getJobId(), job.getStatus().getCode(), job.getUpdatedAt(), target.getCode());
            }
        }
        return count;
    }
}

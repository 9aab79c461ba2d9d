package com.vidforge.worker.service.worker;

import com.vidforge.common.enums.JobStatus;
import com.vidforge.common.exception.ErrorCode;
import com.vidforge.common.exception.JobException;
import com.vidforge.worker.entity.Job;
import com.vidforge.worker.entity.progress.JobProgress;
import com.vidforge.worker.store.JobPatch;
import com.vidforge.worker.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 치명적 오류 기록: 작업을 error 로 전이하고 메시지 / 예외를 남긴다.
 * error 는 종료 상태이며 이후 자동 전이는 없다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobFailureHandler {

    private final JobStore jobStore;
    private final Clock clock;

    public void markFailed(Job job, Throwable cause) {
        String message = describe(cause);
        log.error("[Worker] jobId={} failed: {}", job.getJobId(), message, cause);

        JobProgress progress = job.progressOrEmpty();
        progress.addError("Worker error: " + message);
        progress.addServiceFailure("worker", cause.getClass().getName() + ": " + cause.getMessage(),
                LocalDateTime.now(clock));
        progress.setCurrentStep(JobStatus.ERROR.getCode());
        if (progress.getRender() != null) {
            progress.getRender().setActiveChunk(null);
        }

        try {
            jobStore.updateJob(job.getJobId(), JobPatch.builder()
                    .status(JobStatus.ERROR)
                    .errorMessage(message)
                    .progress(progress)
                    .clearExternalRender(true)
                    .build());
        } catch (RuntimeException e) {
            // 저장소 장애: 정체 감지기가 이후 작업을 되돌린다
            log.error("[Worker] jobId={} - failed to persist error state: {}", job.getJobId(), e.getMessage(), e);
        }
    }

    static String describe(Throwable cause) {
        if (cause instanceof JobException) {
            return ((JobException) cause).toJobMessage();
        }
        return "[" + ErrorCode.INTERNAL_ERROR.getCode() + "] " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}

package com.vidforge.worker.service.worker;

import com.vidforge.worker.config.WorkerIdentity;
import com.vidforge.worker.config.WorkerProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;

/**
 * 워커 시작 순서: 설정 검증 → 렌더 복구 → 폴러 / 정체 감지기 타이머 시작
 * 종료 시 타이머를 순서대로 멈추며 진행중인 청크 상태는 그대로 남긴다 (다음 시작 시 복구).
 */
@Slf4j
@Component
@Order(10)
@ConditionalOnProperty(name = "worker.enabled", havingValue = "true", matchIfMissing = true)
public class WorkerBootstrap implements ApplicationRunner {

    private final WorkerProperties workerProperties;
    private final WorkerIdentity workerIdentity;
    private final StartupRecoveryService recoveryService;
    private final JobPoller jobPoller;
    private final StallDetector stallDetector;
    private final ThreadPoolTaskScheduler scheduler;

    private ScheduledFuture<?> pollFuture;
    private ScheduledFuture<?> stallFuture;

    public WorkerBootstrap(WorkerProperties workerProperties, WorkerIdentity workerIdentity,
                           StartupRecoveryService recoveryService, JobPoller jobPoller, StallDetector stallDetector,
                           @Qualifier("workerScheduler") ThreadPoolTaskScheduler scheduler) {
        this.workerProperties = workerProperties;
        this.workerIdentity = workerIdentity;
        this.recoveryService = recoveryService;
        this.jobPoller = jobPoller;
        this.stallDetector = stallDetector;
        this.scheduler = scheduler;
    }

    @Override
    public void run(ApplicationArguments args) {
        workerProperties.validate();

        log.info("[Worker] Starting {} - poll interval: {}s, stall thresholds: generation {}s / render {}s",
                workerIdentity.getWorkerId(),
                workerProperties.getPoll().getInterval().toSeconds(),
                workerProperties.getStall().getGenerationThreshold().toSeconds(),
                workerProperties.getStall().getRenderThreshold().toSeconds());

        recoveryService.recover();

        pollFuture = scheduler.scheduleWithFixedDelay(jobPoller::runScheduled, workerProperties.getPoll().getInterval());
        stallFuture = scheduler.scheduleWithFixedDelay(stallDetector::runScheduled,
                workerProperties.getStall().getCheckInterval());
        log.info("[Worker] Poller and stall detector started");
    }

    @PreDestroy
    public void stop() {
        log.info("[Worker] Shutting down {}", workerIdentity.getWorkerId());
        if (pollFuture != null) {
            pollFuture.cancel(true);
        }
        if (stallFuture != null) {
            stallFuture.cancel(true);
        }
        log.info("[Worker] Timers stopped; in-flight chunk state is left for the next startup recovery");
    }
}

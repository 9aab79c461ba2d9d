package com.vidforge.worker.service.render;

import com.vidforge.worker.config.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 청크 디스패치 적응형 간격 조절
 * - rate limit 응답 시 간격 증가
 * - 연속 성공 시 간격 점진 감소
 */
@Slf4j
@Component
public class RenderDispatchThrottle {

    private final long minDelayMs;
    private final long maxDelayMs;
    private final double successDecreaseRatio;
    private final double errorIncreaseRatio;
    private final int successStreakForDecrease;

    private final AtomicLong currentDelayMs;
    private final AtomicLong lastDispatchMs;
    private final AtomicInteger successStreak = new AtomicInteger(0);

    public RenderDispatchThrottle(WorkerProperties workerProperties) {
        WorkerProperties.Throttle cfg = workerProperties.getRender().getThrottle();
        this.minDelayMs = cfg.getMinDelayMs();
        this.maxDelayMs = cfg.getMaxDelayMs();
        this.successDecreaseRatio = cfg.getSuccessDecreaseRatio();
        this.errorIncreaseRatio = cfg.getErrorIncreaseRatio();
        this.successStreakForDecrease = cfg.getSuccessStreakForDecrease();
        this.currentDelayMs = new AtomicLong(cfg.getInitialDelayMs());
        // 첫 디스패치는 대기 없이
        this.lastDispatchMs = new AtomicLong(System.currentTimeMillis() - cfg.getInitialDelayMs());

        log.info("[RenderThrottle] Initialized - delay: {}ms, range: {}ms-{}ms",
                cfg.getInitialDelayMs(), minDelayMs, maxDelayMs);
    }

    /**
     * 마지막 디스패치로부터 현재 간격만큼 지나지 않았으면 대기
     */
    public void waitIfNeeded() throws InterruptedException {
        long elapsed = System.currentTimeMillis() - lastDispatchMs.get();
        long delay = currentDelayMs.get();
        if (elapsed < delay) {
            long waitTime = delay - elapsed;
            log.debug("[RenderThrottle] Waiting {}ms before dispatch", waitTime);
            Thread.sleep(waitTime);
        }
        lastDispatchMs.set(System.currentTimeMillis());
    }

    public void recordSuccess() {
        int streak = successStreak.incrementAndGet();
        if (streak >= successStreakForDecrease) {
            long oldDelay = currentDelayMs.get();
            long newDelay = Math.max(minDelayMs, (long) (oldDelay * successDecreaseRatio));
            if (newDelay < oldDelay && currentDelayMs.compareAndSet(oldDelay, newDelay)) {
                log.info("[RenderThrottle] Success streak {} - delay decreased: {}ms -> {}ms", streak, oldDelay, newDelay);
                successStreak.set(0);
            }
        }
    }

    public void recordRateLimited() {
        successStreak.set(0);
        long oldDelay = currentDelayMs.get();
        long newDelay = Math.min(maxDelayMs, Math.max(minDelayMs, (long) (oldDelay * errorIncreaseRatio)));
        if (currentDelayMs.compareAndSet(oldDelay, newDelay)) {
            log.warn("[RenderThrottle] Rate limited - delay increased: {}ms -> {}ms", oldDelay, newDelay);
        }
    }

    public long getCurrentDelayMs() {
        return currentDelayMs.get();
    }
}

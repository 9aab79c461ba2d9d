package com.vidforge.worker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 워커 설정 (worker.*)
 * 모든 주기 / 임계값은 설정으로만 주입되며 코드에 하드코딩하지 않는다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {

    private Poll poll = new Poll();
    private Stall stall = new Stall();
    private Render render = new Render();
    private Quality quality = new Quality();
    private Services services = new Services();

    @Getter
    @Setter
    public static class Poll {
        /** 작업 큐 폴링 주기 */
        private Duration interval = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Stall {
        /** 정체 검사 주기 */
        private Duration checkInterval = Duration.ofSeconds(60);
        /** generating 상태 정체 임계값 */
        private Duration generationThreshold = Duration.ofMinutes(5);
        /** lambda_pending / rendering 상태 정체 임계값 */
        private Duration renderThreshold = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Render {
        /** 청크 하나의 최대 길이 (초) */
        private double maxChunkDurationSeconds = 120;
        /** 원격 실행기의 1회 실행 시간 제한 */
        private Duration executorTimeLimit = Duration.ofMinutes(15);
        /** 청크 상태 조회 주기 */
        private Duration chunkPollInterval = Duration.ofSeconds(5);
        /** 하나의 청크가 in_progress 로 머무를 수 있는 최대 시간 */
        private Duration chunkTimeout = Duration.ofMinutes(14);
        /** 연속 상태 조회 실패 허용 횟수 */
        private int maxConsecutivePollErrors = 5;
        /** rate limit 디스패치 재시도 횟수 */
        private int maxDispatchAttempts = 3;
        /** rate limit 재시도 대기 (시도 횟수만큼 곱해짐) */
        private Duration rateLimitCooldown = Duration.ofSeconds(60);
        /** 청크 간 대기 */
        private Duration interChunkCooldown = Duration.ofSeconds(15);
        private int defaultFps = 30;
        /** 청크 다운로드 / 병합 작업 디렉토리 */
        private String workDir = System.getProperty("java.io.tmpdir") + "/vidforge/render";
        private Duration ffmpegTimeout = Duration.ofMinutes(10);
        private Throttle throttle = new Throttle();
    }

    @Getter
    @Setter
    public static class Throttle {
        private long initialDelayMs = 2000;
        private long minDelayMs = 1000;
        private long maxDelayMs = 30000;
        private double successDecreaseRatio = 0.9;
        private double errorIncreaseRatio = 1.5;
        private int successStreakForDecrease = 3;
    }

    @Getter
    @Setter
    public static class Quality {
        private int minimumSceneScore = 70;
        private int minimumProjectScore = 75;
        private int autoApproveScore = 85;
    }

    @Getter
    @Setter
    public static class Services {
        private String assetGenerationUrl = "http://localhost:8081";
        private String sceneAnalysisUrl = "http://localhost:8082";
        private String renderExecutorUrl = "http://localhost:8083";
    }

    /**
     * 설정 간 제약 검증 (워커 시작 시 1회)
     * - poll interval < render stall threshold <= executor time limit
     * - chunk poll interval < render stall threshold
     * - max chunk duration <= executor time limit
     */
    public void validate() {
        Duration executorLimit = render.getExecutorTimeLimit();
        if (!poll.getInterval().minus(stall.getRenderThreshold()).isNegative()) {
            throw new IllegalStateException("worker.poll.interval must be shorter than worker.stall.render-threshold");
        }
        if (!render.getChunkPollInterval().minus(stall.getRenderThreshold()).isNegative()) {
            throw new IllegalStateException("worker.render.chunk-poll-interval must be shorter than worker.stall.render-threshold");
        }
        if (stall.getRenderThreshold().compareTo(executorLimit) > 0) {
            throw new IllegalStateException("worker.stall.render-threshold must not exceed worker.render.executor-time-limit");
        }
        if (render.getMaxChunkDurationSeconds() <= 0
                || render.getMaxChunkDurationSeconds() > executorLimit.getSeconds()) {
            throw new IllegalStateException("worker.render.max-chunk-duration-seconds must be in (0, executor-time-limit]");
        }
        if (stall.getGenerationThreshold().isNegative() || stall.getGenerationThreshold().isZero()) {
            throw new IllegalStateException("worker.stall.generation-threshold must be positive");
        }
        if (render.getMaxDispatchAttempts() < 1) {
            throw new IllegalStateException("worker.render.max-dispatch-attempts must be at least 1");
        }
    }
}

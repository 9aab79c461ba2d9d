package com.vidforge.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * 워커 타이머 / 백그라운드 실행기 설정
 * - workerScheduler: 작업 폴러와 정체 감지기가 각자 스레드를 사용 (서로 막지 않음)
 * - recoveryExecutor: 재시작 시 진행중이던 청크를 백그라운드에서 이어서 폴링
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "workerScheduler")
    public ThreadPoolTaskScheduler workerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("vidforge-timer-");
        // 종료 시 실행중인 틱은 인터럽트 (진행중인 청크 상태는 그대로 남긴다)
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "recoveryExecutor")
    public ThreadPoolTaskExecutor recoveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("vidforge-recovery-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}

package com.vidforge.worker.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 워커 인스턴스 식별자: worker_{pid}_{시작 시각 millis}
 * 작업 claim 시 worker_id 컬럼에 기록된다.
 */
@Slf4j
@Getter
@Component
public class WorkerIdentity {

    private final String workerId;

    public WorkerIdentity() {
        this("worker_" + ProcessHandle.current().pid() + "_" + System.currentTimeMillis());
    }

    public WorkerIdentity(String workerId) {
        this.workerId = workerId;
        log.info("[Worker] Worker id: {}", workerId);
    }
}
